package com.fastguard.core.breaker;

import com.fastguard.core.cancel.CancellationToken;
import com.fastguard.exception.CircuitOpenException;
import com.fastguard.exception.GuardCancelledException;
import com.fastguard.exception.NonRetryableException;
import com.fastguard.model.enums.CircuitState;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * 三态熔断器 CLOSED / OPEN / HALF_OPEN, 状态机委托给 resilience4j
 * <p>
 * CLOSED 用大小为 failureThreshold 的计数窗口 + 100% 失败率, 即连续 failureThreshold 次失败才打开.
 * OPEN 超过 recoveryTimeout 后的下一次调用进入 HALF_OPEN; HALF_OPEN 放行 permittedCallsInHalfOpen 个试探.
 * 取消与 ignorePredicate 命中的失败只归还许可, 不计入统计.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /** resilience4j 的 OPEN 等待时长下限 */
    private static final Duration MIN_WAIT_IN_OPEN = Duration.ofMillis(1);

    /** 慢调用不参与熔断判定, 阈值取足够大 */
    private static final Duration SLOW_CALL_DISABLED = Duration.ofDays(365);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;

    private final List<CircuitTransitionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Instant lastTransitionTime;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, 1,
                e -> e instanceof NonRetryableException, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout,
                          int permittedCallsInHalfOpen, Predicate<Throwable> ignorePredicate, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be >= 0");
        }
        if (permittedCallsInHalfOpen < 1) {
            throw new IllegalArgumentException("permittedCallsInHalfOpen must be >= 1");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.lastTransitionTime = this.clock.instant();

        Predicate<Throwable> ignore = ignorePredicate == null ? e -> false : ignorePredicate;
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                .slowCallRateThreshold(100)
                .slowCallDurationThreshold(SLOW_CALL_DISABLED)
                .waitDurationInOpenState(recoveryTimeout.compareTo(MIN_WAIT_IN_OPEN) < 0 ? MIN_WAIT_IN_OPEN : recoveryTimeout)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .permittedNumberOfCallsInHalfOpenState(permittedCallsInHalfOpen)
                .recordExceptions(Throwable.class)
                // 取消的调用永远不算依赖故障
                .ignoreException(e -> e instanceof GuardCancelledException || ignore.test(e))
                .clock(this.clock)
                .build();
        this.delegate = io.github.resilience4j.circuitbreaker.CircuitBreaker.of(name, cfg);
        this.delegate.getEventPublisher().onStateTransition(this::publish);
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, CancellationToken.none());
    }

    /**
     * 经熔断器执行一次调用; 拒绝时抛 CircuitOpenException 且不调用 operation,
     * 其余失败记录后原样抛出
     */
    public <T> T execute(Callable<T> operation, CancellationToken token) throws Exception {
        Objects.requireNonNull(operation, "operation");
        CancellationToken t = token == null ? CancellationToken.none() : token;
        // 已取消的调用不占用半开试探名额
        t.throwIfCancelled();

        try {
            delegate.acquirePermission();
        } catch (CallNotPermittedException open) {
            throw new CircuitOpenException(name, getState(), open);
        }
        long start = System.nanoTime();
        T result;
        try {
            result = operation.call();
        } catch (Exception | Error e) {
            delegate.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            throw e;
        }
        delegate.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        return result;
    }

    /**
     * 强制回到 CLOSED 并清零计数
     */
    public void reset() {
        delegate.reset();
    }

    public CircuitBreakerSnapshot snapshot() {
        io.github.resilience4j.circuitbreaker.CircuitBreaker.Metrics m = delegate.getMetrics();
        return CircuitBreakerSnapshot.builder()
                .name(name)
                .state(getState())
                .failureCount(m.getNumberOfFailedCalls())
                .successCount(m.getNumberOfSuccessfulCalls())
                .failureThreshold(failureThreshold)
                .recoveryTimeout(recoveryTimeout)
                .lastTransitionTime(lastTransitionTime)
                .build();
    }

    public CircuitState getState() {
        return toState(delegate.getState());
    }

    public String getName() {
        return name;
    }

    public void addListener(CircuitTransitionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void publish(CircuitBreakerOnStateTransitionEvent event) {
        io.github.resilience4j.circuitbreaker.CircuitBreaker.StateTransition st = event.getStateTransition();
        lastTransitionTime = clock.instant();
        CircuitTransition transition = new CircuitTransition(name,
                toState(st.getFromState()), toState(st.getToState()), lastTransitionTime);
        if (transition.getTo() == CircuitState.OPEN) {
            log.warn("[Breaker] {}", transition);
        } else {
            log.info("[Breaker] {}", transition);
        }
        for (CircuitTransitionListener l : listeners) {
            try {
                l.onTransition(transition);
            } catch (RuntimeException e) {
                log.warn("[Breaker] transition listener failed circuit={} listener={}",
                        name, l.getClass().getName(), e);
            }
        }
    }

    /** 只配置三态, DISABLED / METRICS_ONLY 视作放行, FORCED_OPEN 视作打开 */
    private static CircuitState toState(io.github.resilience4j.circuitbreaker.CircuitBreaker.State s) {
        switch (s) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }
}
