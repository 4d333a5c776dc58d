package com.fastguard.core.notify.route;

import com.fastguard.core.spi.notify.Notifier;
import com.fastguard.core.spi.notify.NotifierRouter;
import com.fastguard.model.NotificationEvent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 按通道路由
 * log 通道总在列表中, 其余通道按配置追加, 再由 Notifier.supports 过滤
 */
public class ChannelRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    public ChannelRouter(List<Notifier> notifiers) {
        this.notifiers = List.copyOf(notifiers);
    }

    @Override
    public List<Notifier> route(NotificationEvent event) {
        return notifiers.stream()
                .filter(n -> n.supports(event))
                .collect(Collectors.toList());
    }

    public List<Notifier> getNotifiers() {
        return notifiers;
    }
}
