package com.fastguard.core.spi.failure;

import lombok.Getter;

/**
 * 失败判定器 按异常类型给出决策
 */
public interface FailureDecider {

    /**
     * 根据异常做出决策
     */
    Decision decide(Throwable t);

    /** 退避执行器使用的默认 retryable 判定 */
    default boolean isRetryable(Throwable t) {
        return decide(t).getOutcome() == Outcome.RETRY;
    }

    @Getter
    final class Decision {
        private final Outcome outcome;
        private final Category category;
        private final String code;

        private Decision(Outcome o, Category c, String code) {
            this.outcome = o; this.category = c; this.code = code;
        }
        public static Decision of(Outcome o, Category c) { return new Decision(o, c, null); }
        public Decision withCode(String code){ return new Decision(outcome, category, code); }

        @Override
        public String toString() {
            return outcome + "/" + category + (code == null ? "" : "(" + code + ")");
        }
    }

    enum Outcome { RETRY, FAIL }
    enum Category { OPEN_CIRCUIT, TIMEOUT, IO, BIZ_4XX, NON_RETRYABLE, UNKNOWN }
}
