package com.fastguard.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 熔断打开, 调用被拒绝 */
    CIRCUIT_OPEN,

    /** 重试耗尽 */
    RETRY_EXHAUSTED,

    /** 超过重处理上限, 死信终态 */
    DEAD_LETTER,

    /** 写入死信失败 */
    DLQ_WRITE_FAILED,

    /** 依赖健康状态变化 */
    HEALTH_CHECK,

    /** 业务自定义告警 */
    CUSTOM
}
