package com.fastguard.model;

import com.fastguard.model.enums.DeadLetterStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * 死信条目
 * 本地文件模式下每次变更整条追加一行, 自描述
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterEntry {

    /** 唯一id（UUID） */
    private String messageId;

    /** 受保护的依赖名, 可为空 */
    private String dependency;

    /** 原始载荷（JSON） */
    private String payload;

    private ErrorInfo errorInfo;

    /** 已重处理失败次数 */
    private int attemptCount;

    private DeadLetterStatus status;

    private Instant createdAt;

    private Instant updatedAt;

    /** IN_FLIGHT 可见性超时, 到期后可被再次拉取 */
    private Instant visibleAfter;

    /** 最近一次重处理失败信息 */
    private String lastReprocessError;

    /** 乐观锁, 每次持久化变更 +1 */
    private long version;

    /**
     * 当前时刻能否被拉取
     */
    public boolean isReceivable(Instant now) {
        if (status == DeadLetterStatus.PENDING) {
            return true;
        }
        return status == DeadLetterStatus.IN_FLIGHT
                && (visibleAfter == null || !now.isBefore(visibleAfter));
    }

    /**
     * 深拷贝, 存储层对外只交出副本
     */
    public DeadLetterEntry copy() {
        DeadLetterEntryBuilder b = toBuilder();
        if (errorInfo != null) {
            b.errorInfo(errorInfo.toBuilder()
                    .attributes(errorInfo.getAttributes() == null ? new LinkedHashMap<>()
                            : new LinkedHashMap<>(errorInfo.getAttributes()))
                    .build());
        }
        return b.build();
    }
}
