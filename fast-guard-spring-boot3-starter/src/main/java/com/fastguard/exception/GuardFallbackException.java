package com.fastguard.exception;

import com.fastguard.model.enums.FailureKind;

/**
 * 受保护调用的兜底失败, 调用方据此走降级回复
 */
public class GuardFallbackException extends RuntimeException {

    private final String dependency;

    private final FailureKind kind;

    /** 进入死信时的消息id, 未写入为 null */
    private final String deadLetterId;

    public GuardFallbackException(String dependency, FailureKind kind, Throwable cause, String deadLetterId) {
        super("[" + dependency + "] protected call failed: " + kind, cause);
        this.dependency = dependency;
        this.kind = kind;
        this.deadLetterId = deadLetterId;
    }

    public String getDependency() {
        return dependency;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getDeadLetterId() {
        return deadLetterId;
    }
}
