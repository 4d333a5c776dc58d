package com.fastguard.core.failure.decider;

import com.fastguard.core.spi.failure.FailureCaseHandler;
import com.fastguard.core.spi.failure.FailureDecider;

import java.io.IOException;

public class IoHandler implements FailureCaseHandler<IOException> {
    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public FailureDecider.Decision execute(IOException ex) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.IO)
                .withCode("IO");
    }
}
