package com.fastguard.model.enums;

/**
 * 受保护调用的终态失败类型
 */
public enum FailureKind {
    /** 熔断拒绝, 未发起调用 */
    CIRCUIT_OPEN,

    /** 重试耗尽 */
    RETRY_EXHAUSTED,

    /** 调用方取消或超过截止时间 */
    CANCELLED
}
