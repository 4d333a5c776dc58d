package com.fastguard.model.enums;

/**
 * 告警提交结果
 */
public enum DispatchResult {
    /** 已进入异步派发队列 */
    ACCEPTED,
    /** 被节流 */
    THROTTLED,
    /** 通知关闭, 或派发队列已满 */
    REJECTED
}
