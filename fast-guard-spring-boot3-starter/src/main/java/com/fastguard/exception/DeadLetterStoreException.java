package com.fastguard.exception;

/**
 * 死信存储读写失败
 */
public class DeadLetterStoreException extends RuntimeException {

    public DeadLetterStoreException(String message) {
        super(message);
    }

    public DeadLetterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
