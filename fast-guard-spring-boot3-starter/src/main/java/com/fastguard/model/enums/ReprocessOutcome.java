package com.fastguard.model.enums;

/**
 * 单条死信重处理结果
 */
public enum ReprocessOutcome {
    /** 成功, 条目归档 */
    REPROCESSED,
    /** 失败但未达上限, 回到 PENDING */
    REQUEUED,
    /** 失败且达到上限 */
    DEAD,
    NOT_FOUND,
    /** 已是终态, 或被其他消费者抢先修改 */
    SKIPPED
}
