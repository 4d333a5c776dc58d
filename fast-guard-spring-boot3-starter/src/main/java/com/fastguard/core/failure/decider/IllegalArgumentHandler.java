package com.fastguard.core.failure.decider;

import com.fastguard.core.spi.failure.FailureCaseHandler;
import com.fastguard.core.spi.failure.FailureDecider;

/**
 * 参数错误重试也不会成功
 */
public class IllegalArgumentHandler implements FailureCaseHandler<IllegalArgumentException> {
    @Override
    public Class<IllegalArgumentException> exceptionType() {
        return IllegalArgumentException.class;
    }

    @Override
    public FailureDecider.Decision execute(IllegalArgumentException ex) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.FAIL, FailureDecider.Category.BIZ_4XX)
                .withCode("BAD_ARGUMENT");
    }
}
