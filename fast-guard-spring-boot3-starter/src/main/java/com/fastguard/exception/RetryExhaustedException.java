package com.fastguard.exception;

/**
 * 重试耗尽, cause 为最后一次失败
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("all " + attempts + " attempts exhausted, last error: "
                + (lastFailure == null ? "null" : lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
