package com.fastguard.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * 死信状态
 */
@AllArgsConstructor
@Getter
public enum DeadLetterStatus {
    PENDING(0, "待处理，可被拉取"),
    IN_FLIGHT(1, "已拉取，可见性超时内独占"),
    REPROCESSED(2, "重处理成功，归档，终态"),
    DEAD(3, "超过重处理上限，不再自动处理，终态")
    ;

    public final int code;
    public final String desc;

    public boolean isTerminal() {
        return this == REPROCESSED || this == DEAD;
    }

    public static DeadLetterStatus ofCode(int code) {
        return Arrays.stream(values())
                .filter(s -> s.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown dead letter status code: " + code));
    }
}
