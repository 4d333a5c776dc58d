package com.fastguard.exception;

/**
 * 调用方取消或超过截止时间
 * 不计入熔断失败
 */
public class GuardCancelledException extends RuntimeException {

    public GuardCancelledException(String reason) {
        super(reason);
    }

    public GuardCancelledException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
