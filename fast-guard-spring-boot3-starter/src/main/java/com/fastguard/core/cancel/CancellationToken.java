package com.fastguard.core.cancel;

import com.fastguard.exception.GuardCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 取消信号 + 可选截止时间
 * 退避等待与半开试探都会检查它; 一个 token 可被多个调用共享
 */
public final class CancellationToken {

    private static final CancellationToken NONE =
            new CancellationToken(null, Clock.systemUTC(), new CountDownLatch(1), new AtomicReference<>());

    private final Instant deadline;

    private final Clock clock;

    /** 派生 token 与源 token 共享同一个信号 */
    private final CountDownLatch cancelled;

    private final AtomicReference<String> reason;

    private CancellationToken(Instant deadline, Clock clock, CountDownLatch cancelled, AtomicReference<String> reason) {
        this.deadline = deadline;
        this.clock = clock;
        this.cancelled = cancelled;
        this.reason = reason;
    }

    /** 永不取消 */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return withDeadline(null, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return withDeadline(Instant.now().plus(timeout), Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(deadline, clock, new CountDownLatch(1), new AtomicReference<>());
    }

    public void cancel(String why) {
        if (this == NONE) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        reason.compareAndSet(null, why);
        cancelled.countDown();
    }

    public void cancel() {
        cancel("cancelled by caller");
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || deadlineExceeded();
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * 已取消或已过截止时间则抛出 GuardCancelledException
     */
    public void throwIfCancelled() {
        if (cancelled.getCount() == 0) {
            String why = reason.get();
            throw new GuardCancelledException(why == null ? "cancelled" : why);
        }
        if (deadlineExceeded()) {
            throw new GuardCancelledException("deadline exceeded: " + deadline);
        }
    }

    /**
     * 可取消的睡眠; 被取消、到达截止时间或线程中断都以 GuardCancelledException 结束
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        long waitNanos = Math.max(0, duration.toNanos());
        boolean cutByDeadline = false;
        if (deadline != null) {
            long untilDeadline = Duration.between(clock.instant(), deadline).toNanos();
            if (untilDeadline <= waitNanos) {
                waitNanos = Math.max(0, untilDeadline);
                cutByDeadline = true;
            }
        }
        try {
            if (cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GuardCancelledException("interrupted while waiting", ie);
        }
        if (cutByDeadline) {
            throw new GuardCancelledException("deadline exceeded: " + deadline);
        }
    }

    /**
     * 派生一个截止时间取二者更早的 token, 取消信号与当前 token 共享
     */
    public CancellationToken withEarlierDeadline(Instant other) {
        if (other == null || (deadline != null && !other.isBefore(deadline))) {
            return this;
        }
        if (this == NONE) {
            return withDeadline(other, clock);
        }
        return new CancellationToken(other, clock, cancelled, reason);
    }

    private boolean deadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
