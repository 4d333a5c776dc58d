package com.fastguard.core.failure.decider;

import com.fastguard.core.spi.failure.FailureCaseHandler;
import com.fastguard.core.spi.failure.FailureDecider;
import com.fastguard.exception.CircuitOpenException;

/**
 * 下游依赖自身的熔断打开, 可重试
 */
public class OpenCircuitHandler implements FailureCaseHandler<CircuitOpenException> {
    @Override
    public Class<CircuitOpenException> exceptionType() {
        return CircuitOpenException.class;
    }

    @Override
    public FailureDecider.Decision execute(CircuitOpenException ex) {
        return FailureDecider.Decision
                .of(FailureDecider.Outcome.RETRY, FailureDecider.Category.OPEN_CIRCUIT)
                .withCode("CB_OPEN:" + ex.getCircuitName());
    }
}
