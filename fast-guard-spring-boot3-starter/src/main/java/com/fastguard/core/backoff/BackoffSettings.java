package com.fastguard.core.backoff;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 一次调用生效的退避参数（全局 -> 依赖级 -> CallOptions 逐层覆盖后的结果）
 */
@Value
@Builder(toBuilder = true)
public class BackoffSettings {
    String strategy;
    Duration baseDelay;
    Duration maxDelay;
    double multiplier;
    int maxRetries;
    boolean jitter;
    Predicate<Throwable> retryable;

    /**
     * 参数不合法直接抛 IllegalArgumentException
     */
    public BackoffSettings validate() {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        return this;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
