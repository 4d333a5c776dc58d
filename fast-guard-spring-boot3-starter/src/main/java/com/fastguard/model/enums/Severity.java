package com.fastguard.model.enums;

/**
 * 告警级别
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean atLeast(Severity other) {
        return this.ordinal() >= other.ordinal();
    }
}
