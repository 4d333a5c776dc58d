package com.fastguard.core.guard;

import com.fastguard.config.GuardDeadLetterProperties;
import com.fastguard.config.GuardNotifierProperties;
import com.fastguard.core.backoff.BackoffRegistry;
import com.fastguard.core.backoff.BackoffStrategy;
import com.fastguard.core.breaker.CircuitBreaker;
import com.fastguard.core.breaker.CircuitBreakerRegistry;
import com.fastguard.core.breaker.CircuitTransition;
import com.fastguard.core.cancel.CancellationToken;
import com.fastguard.core.dlq.DeadLetterQueue;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.core.notify.AdminNotifier;
import com.fastguard.core.notify.NotificationEvents;
import com.fastguard.core.spi.PayloadSerializer;
import com.fastguard.exception.CircuitOpenException;
import com.fastguard.exception.GuardCancelledException;
import com.fastguard.exception.GuardFallbackException;
import com.fastguard.exception.NonRetryableException;
import com.fastguard.exception.RetryExhaustedException;
import com.fastguard.model.CallOptions;
import com.fastguard.model.ErrorInfo;
import com.fastguard.model.enums.CircuitState;
import com.fastguard.model.enums.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 受保护调用统一入口
 * <p>
 * breaker(dependency).execute( backoff(dependency, options).execute(operation) ):
 * 一次完整的退避重试在熔断器眼里只算一次调用.
 * 熔断拒绝与重试耗尽会落死信、发告警, 并以 {@link GuardFallbackException} 交给调用方降级;
 * 不可重试的失败原样上抛.
 */
public class GuardedCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(GuardedCallExecutor.class);

    private final CircuitBreakerRegistry breakers;
    private final BackoffRegistry backoffs;
    private final DeadLetterQueue dlq;
    private final AdminNotifier notifier;
    private final PayloadSerializer serializer;
    private final GuardDeadLetterProperties dlqProps;
    private final GuardNotifierProperties notifyProps;
    private final GuardMetrics metrics;
    private final Clock clock;

    public GuardedCallExecutor(CircuitBreakerRegistry breakers, BackoffRegistry backoffs, DeadLetterQueue dlq,
                               AdminNotifier notifier, PayloadSerializer serializer,
                               GuardDeadLetterProperties dlqProps, GuardNotifierProperties notifyProps,
                               GuardMetrics metrics, Clock clock) {
        this.breakers = breakers;
        this.backoffs = backoffs;
        this.dlq = dlq;
        this.notifier = notifier;
        this.serializer = serializer;
        this.dlqProps = dlqProps;
        this.notifyProps = notifyProps;
        this.metrics = metrics;
        this.clock = clock;
        // 熔断状态变化同步为健康检查告警
        breakers.addListener(this::reportHealth);
    }

    public <T> T protectedCall(String dependency, Callable<T> operation, Object payload) {
        return protectedCall(dependency, operation, payload, CallOptions.defaults());
    }

    public <T> T protectedCall(String dependency, Callable<T> operation, Object payload, CallOptions options) {
        Objects.requireNonNull(dependency, "dependency");
        Objects.requireNonNull(operation, "operation");
        CallOptions opts = options == null ? CallOptions.defaults() : options;
        CancellationToken base = opts.getCancellationToken() == null ? CancellationToken.none() : opts.getCancellationToken();
        CancellationToken token = base.withEarlierDeadline(opts.getDeadline());

        CircuitBreaker cb = breakers.get(dependency);
        BackoffStrategy strategy = backoffs.strategyFor(dependency, opts, (attempt, failure, delay) ->
                log.debug("[Guard] dependency={} attempt={} in {}ms after {}", dependency, attempt,
                        delay.toMillis(), failure.toString()));

        AtomicInteger attempts = new AtomicInteger();
        Callable<T> counted = () -> {
            attempts.incrementAndGet();
            return operation.call();
        };
        long start = System.nanoTime();
        try {
            T result = cb.execute(() -> strategy.execute(counted, token), token);
            metrics.incSuccess();
            return result;
        } catch (CircuitOpenException e) {
            throw onCircuitOpen(dependency, payload, e);
        } catch (RetryExhaustedException e) {
            throw onRetryExhausted(dependency, payload, e);
        } catch (GuardCancelledException e) {
            metrics.incCancelled();
            log.info("[Guard] dependency={} cancelled after {} attempts: {}", dependency, attempts.get(), e.getMessage());
            throw new GuardFallbackException(dependency, FailureKind.CANCELLED, e, null);
        } catch (NonRetryableException e) {
            metrics.incFailed();
            log.warn("[Guard] dependency={} non-retryable failure: {}", dependency, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // 退避执行器只抛非受检异常
            throw new IllegalStateException("unexpected checked exception from guarded call", e);
        } finally {
            metrics.recordCallNanos(System.nanoTime() - start);
            if (attempts.get() > 0) {
                metrics.recordAttempts(attempts.get());
            }
        }
    }

    private GuardFallbackException onCircuitOpen(String dependency, Object payload, CircuitOpenException e) {
        metrics.incRejected();
        log.warn("[Guard] dependency={} rejected, circuit {}", dependency, e.getState());
        notifier.sendNotification(NotificationEvents.circuitOpen(dependency, e, clock));
        String deadLetterId = null;
        if (dlqProps.isCaptureOnCircuitOpen()) {
            ErrorInfo info = ErrorInfo.of(FailureKind.CIRCUIT_OPEN.name(), e, clock)
                    .with("dependency", dependency)
                    .with("state", e.getState());
            deadLetterId = dlq.sendToDlq(dependency, payload, info).orElse(null);
        }
        return new GuardFallbackException(dependency, FailureKind.CIRCUIT_OPEN, e, deadLetterId);
    }

    private GuardFallbackException onRetryExhausted(String dependency, Object payload, RetryExhaustedException e) {
        metrics.incExhausted();
        metrics.incFailed();
        Throwable last = e.getCause();
        log.error("[Guard] dependency={} exhausted after {} attempts, last={}", dependency, e.getAttempts(),
                last == null ? null : last.toString());
        ErrorInfo info = ErrorInfo.of(FailureKind.RETRY_EXHAUSTED.name(), last, clock)
                .with("dependency", dependency)
                .with("attempts", e.getAttempts());
        String deadLetterId = dlq.sendToDlq(dependency, payload, info).orElse(null);
        String snapshot = NotificationEvents.snapshot(render(payload), notifyProps.getPayloadSnapshotLength());
        notifier.sendNotification(NotificationEvents.retryExhausted(dependency, e.getAttempts(), last,
                snapshot, deadLetterId, clock));
        return new GuardFallbackException(dependency, FailureKind.RETRY_EXHAUSTED, e, deadLetterId);
    }

    private void reportHealth(CircuitTransition t) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dependency", t.getCircuitName());
        details.put("from", t.getFrom());
        details.put("to", t.getTo());
        if (t.getTo() == CircuitState.OPEN) {
            notifier.sendHealthCheckNotification(false, details);
        } else if (t.getTo() == CircuitState.CLOSED) {
            notifier.sendHealthCheckNotification(true, details);
        }
    }

    private String render(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return serializer.serialize(payload);
        } catch (RuntimeException ex) {
            log.debug("[Guard] payload not serializable for snapshot: {}", ex.getMessage());
            return String.valueOf(payload);
        }
    }

    public CircuitBreakerRegistry getBreakers() {
        return breakers;
    }

    public DeadLetterQueue getDeadLetterQueue() {
        return dlq;
    }

    public AdminNotifier getNotifier() {
        return notifier;
    }
}
