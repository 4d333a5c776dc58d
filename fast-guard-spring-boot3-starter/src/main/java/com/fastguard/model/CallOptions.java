package com.fastguard.model;

import com.fastguard.core.cancel.CancellationToken;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;

/**
 * 单次受保护调用的可选参数, 为空的字段取依赖级/全局配置
 */
@Data
@Builder(toBuilder = true)
public class CallOptions {

    private Integer maxRetries;
    private Duration baseDelay;
    private Duration maxDelay;
    private Double multiplier;
    private Boolean jitter;
    /** 是否可重试, 为空则交给 FailureDecider */
    private Predicate<Throwable> retryable;
    /** 外部取消信号 */
    private CancellationToken cancellationToken;
    /** 总体截止时间, 与 cancellationToken 合并生效 */
    private Instant deadline;

    public static CallOptions defaults() {
        return CallOptions.builder().build();
    }
}
