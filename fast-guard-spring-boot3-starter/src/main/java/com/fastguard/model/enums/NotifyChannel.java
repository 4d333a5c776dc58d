package com.fastguard.model.enums;

/**
 * 告警通道
 */
public enum NotifyChannel {
    /** 仅日志 */
    LOG,

    /** 日志 + Kafka 告警 topic */
    KAFKA
}
