package com.fastguard.core.spi.notify;

import com.fastguard.model.NotificationEvent;

/**
 * 告警通道（熔断打开/重试耗尽/死信/健康检查等）
 */
public interface Notifier {

    /**
     * 返回此Notifier支持的渠道/名称, 用于路由日志与指标纬度
     */
    String name();

    /**
     * 能否处理此事件, 粗粒度过滤
     */
    default boolean supports(NotificationEvent event) {
        return true;
    }

    /**
     * 派发通知, 同步方法 框架层负责异步调用与重试
     */
    void notify(NotificationEvent event) throws Exception;

}
