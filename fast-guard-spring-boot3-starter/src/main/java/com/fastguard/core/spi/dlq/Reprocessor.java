package com.fastguard.core.spi.dlq;

import com.fastguard.model.DeadLetterEntry;

/**
 * 死信重处理, 需幂等（租约过期后同一条目可能被再次投递）
 */
@FunctionalInterface
public interface Reprocessor {

    /**
     * @return true 处理成功; false 或抛异常视为失败
     */
    boolean reprocess(DeadLetterEntry entry) throws Exception;
}
