package com.fastguard.core.spi.dlq;

import com.fastguard.model.DeadLetterEntry;
import com.fastguard.model.enums.DeadLetterStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 死信存储后端
 * <p>
 * 所有方法失败时抛 {@link com.fastguard.exception.DeadLetterStoreException} 或底层的非受检异常;
 * 返回给调用方的条目均为副本.
 */
public interface DeadLetterStore {

    /** 后端名称, 用于日志 */
    String name();

    /** 新增条目 */
    void save(DeadLetterEntry entry);

    Optional<DeadLetterEntry> find(String messageId);

    /**
     * 认领至多 max 条可拉取条目（PENDING 或租约已过期的 IN_FLIGHT）,
     * 置为 IN_FLIGHT 且 visibleAfter = leaseUntil
     */
    List<DeadLetterEntry> claim(int max, Instant now, Instant leaseUntil);

    /**
     * 按 version 乐观更新; 成功后 entry.version 随存储一起递增
     * @return false 条目不存在或已被他人修改
     */
    boolean update(DeadLetterEntry entry);

    boolean delete(String messageId);

    /**
     * @param status 为空表示全部
     */
    List<DeadLetterEntry> list(DeadLetterStatus status, int limit);

    Map<DeadLetterStatus, Long> countByStatus();

    /** 清空, 返回删除条数 */
    int purge();
}
