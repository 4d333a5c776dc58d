package com.fastguard.core.spi.notify;

import com.fastguard.model.NotificationEvent;

import java.util.List;

/**
 * 路由：根据事件 → 选择若干 Notifier
 */
public interface NotifierRouter {

    List<Notifier> route(NotificationEvent event);
}
