package com.fastguard.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 时间列统一存 UTC
 */
@TableName("guard_dead_letter")
@Data
public class DeadLetterEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 对外可见 id（UUID） */
    private String messageId;

    private String dependency;

    /** 原始载荷 JSON */
    private String payload;

    private String errorKind;

    private String errorMessage;

    /** ErrorInfo.attributes 的 JSON */
    private String errorAttributes;

    private LocalDateTime errorTime;

    private Integer attemptCount;

    /**
     * 0=PENDING,1=IN_FLIGHT,2=REPROCESSED,3=DEAD
     */
    private Integer status;

    /** IN_FLIGHT 租约到期时间 */
    private LocalDateTime visibleAfter;

    private String lastReprocessError;

    /** 乐观锁 */
    private Long version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
