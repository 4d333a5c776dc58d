package com.fastguard.core.metric;

import com.fastguard.core.breaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class GuardMetrics {
    private final MeterRegistry registry;
    private final Counter success;
    private final Counter failed;
    private final Counter rejected;
    private final Counter cancelled;
    private final Counter exhausted;
    private final Counter dlqWritten;
    private final Counter dlqWriteFailed;
    private final Counter dlqReprocessed;
    private final Counter dlqDead;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary attempts;
    private final Timer callTimer;

    private GuardMetrics(MeterRegistry reg) {
        this.registry = reg;
        this.success   = Counter.builder("guard.call.success").description("guarded calls succeeded").register(reg);
        this.failed    = Counter.builder("guard.call.failed").description("guarded calls failed terminally").register(reg);
        this.rejected  = Counter.builder("guard.circuit.rejected").description("calls rejected by open circuit").register(reg);
        this.cancelled = Counter.builder("guard.call.cancelled").description("guarded calls cancelled").register(reg);
        this.exhausted = Counter.builder("guard.retry.exhausted").description("retry budget exhausted").register(reg);
        this.dlqWritten     = Counter.builder("guard.dlq.written").description("entries dead-lettered").register(reg);
        this.dlqWriteFailed = Counter.builder("guard.dlq.write.failed").description("dead-letter writes failed").register(reg);
        this.dlqReprocessed = Counter.builder("guard.dlq.reprocessed").description("entries reprocessed").register(reg);
        this.dlqDead        = Counter.builder("guard.dlq.dead").description("entries given up").register(reg);
        this.notifySuppressed = Counter.builder("guard.notify.suppressed").description("notify throttled").register(reg);
        this.notifySent   = Counter.builder("guard.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("guard.notify.failed").description("notify failed").register(reg);
        this.attempts = DistributionSummary.builder("guard.retry.attempts")
                .description("attempt count per guarded call").baseUnit("times").register(reg);
        this.callTimer = Timer.builder("guard.call.time").description("guarded call time").register(reg);
    }

    public static GuardMetrics create(MeterRegistry reg) { return new GuardMetrics(reg); }

    /** 单测 / 无 Spring 场景 */
    public static GuardMetrics simple() { return new GuardMetrics(new SimpleMeterRegistry()); }

    /**
     * 熔断状态 gauge: 0=CLOSED 1=OPEN 2=HALF_OPEN
     */
    public void bindBreaker(CircuitBreaker breaker) {
        Gauge.builder("guard.circuit.state", breaker, b -> b.getState().ordinal())
                .description("circuit state")
                .tag("name", breaker.getName())
                .register(registry);
    }

    public void incSuccess(){ success.increment(); }
    public void incFailed(){ failed.increment(); }
    public void incRejected(){ rejected.increment(); }
    public void incCancelled(){ cancelled.increment(); }
    public void incExhausted(){ exhausted.increment(); }
    public void incDlqWritten(){ dlqWritten.increment(); }
    public void incDlqWriteFailed(){ dlqWriteFailed.increment(); }
    public void incDlqReprocessed(){ dlqReprocessed.increment(); }
    public void incDlqDead(){ dlqDead.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment(); }
    public void incNotifySent(){ notifySent.increment(); }
    public void incNotifyFailed(){ notifyFailed.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordCallNanos(long nanos){ callTimer.record(nanos, TimeUnit.NANOSECONDS); }

    public MeterRegistry getRegistry() { return registry; }
}
