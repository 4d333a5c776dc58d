package com.fastguard.core.breaker;

import com.fastguard.model.enums.CircuitState;

import java.time.Instant;

/**
 * 一次状态迁移
 */
public final class CircuitTransition {

    private final String circuitName;
    private final CircuitState from;
    private final CircuitState to;
    private final Instant at;

    public CircuitTransition(String circuitName, CircuitState from, CircuitState to, Instant at) {
        this.circuitName = circuitName;
        this.from = from;
        this.to = to;
        this.at = at;
    }

    public String getCircuitName() { return circuitName; }
    public CircuitState getFrom() { return from; }
    public CircuitState getTo() { return to; }
    public Instant getAt() { return at; }

    @Override
    public String toString() {
        return circuitName + ": " + from + " -> " + to + " @" + at;
    }
}
