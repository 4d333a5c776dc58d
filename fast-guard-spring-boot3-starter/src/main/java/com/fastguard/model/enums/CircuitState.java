package com.fastguard.model.enums;

/**
 * 熔断器状态
 */
public enum CircuitState {
    /** 关闭（正常放行） */
    CLOSED,

    /** 打开（快速失败） */
    OPEN,

    /** 半开（放行有限的试探调用） */
    HALF_OPEN
}
