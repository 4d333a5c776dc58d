package com.fastguard.core.breaker;

import com.fastguard.model.enums.CircuitState;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 熔断器只读快照, 供运维查询/健康检查
 */
@Value
@Builder
public class CircuitBreakerSnapshot {
    String name;
    CircuitState state;
    int failureCount;
    int successCount;
    int failureThreshold;
    Duration recoveryTimeout;
    Instant lastTransitionTime;
}
