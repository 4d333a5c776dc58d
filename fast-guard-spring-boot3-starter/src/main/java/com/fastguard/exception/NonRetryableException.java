package com.fastguard.exception;

/**
 * 不可重试的失败, 立即上抛, 不消耗重试预算
 * 业务可直接抛出, 也由退避执行器包装被判定为不可重试的原始异常
 */
public class NonRetryableException extends RuntimeException {

    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }

    public NonRetryableException(Throwable cause) {
        super("non-retryable failure: " + (cause == null ? "null" : cause.getMessage()), cause);
    }
}
