package com.fastguard.core.spi.notify;

import com.fastguard.model.NotificationEvent;

/**
 * 过滤器：节流、去抖、按依赖白名单过滤等
 */
public interface NotifierFilter {

    /**
     * 返回 true 表示放行，false 表示丢弃/抑制
     */
    boolean allow(NotificationEvent event);
}
