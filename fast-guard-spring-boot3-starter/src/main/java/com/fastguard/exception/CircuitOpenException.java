package com.fastguard.exception;

import com.fastguard.model.enums.CircuitState;

/**
 * 熔断拒绝, 底层调用未发起
 */
public class CircuitOpenException extends RuntimeException {

    private final String circuitName;

    private final CircuitState state;

    public CircuitOpenException(String circuitName, CircuitState state) {
        super("circuit '" + circuitName + "' is " + state + ", call rejected");
        this.circuitName = circuitName;
        this.state = state;
    }

    public CircuitOpenException(String circuitName, CircuitState state, Throwable cause) {
        super("circuit '" + circuitName + "' is " + state + ", call rejected", cause);
        this.circuitName = circuitName;
        this.state = state;
    }

    public String getCircuitName() {
        return circuitName;
    }

    public CircuitState getState() {
        return state;
    }
}
