package com.fastguard.core.failure.decider;

import com.fastguard.core.spi.failure.FailureCaseHandler;
import com.fastguard.core.spi.failure.FailureDecider;
import com.fastguard.exception.NonRetryableException;

/**
 * 业务显式声明不可重试
 */
public class NonRetryableHandler implements FailureCaseHandler<NonRetryableException> {
    @Override
    public Class<NonRetryableException> exceptionType() {
        return NonRetryableException.class;
    }

    @Override
    public FailureDecider.Decision execute(NonRetryableException ex) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.FAIL, FailureDecider.Category.NON_RETRYABLE)
                .withCode("NON_RETRYABLE");
    }
}
