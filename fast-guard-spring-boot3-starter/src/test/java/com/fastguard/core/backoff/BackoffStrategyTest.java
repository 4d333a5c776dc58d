package com.fastguard.core.backoff;

import com.fastguard.core.cancel.CancellationToken;
import com.fastguard.exception.GuardCancelledException;
import com.fastguard.exception.NonRetryableException;
import com.fastguard.exception.RetryExhaustedException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffStrategyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final BackoffStrategy.Sleeper recordingSleeper = (d, token) -> sleeps.add(d);

    private static BackoffSettings settings(int maxRetries) {
        return BackoffSettings.builder()
                .strategy("exponential")
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(30))
                .multiplier(2.0)
                .maxRetries(maxRetries)
                .jitter(false)
                .build();
    }

    @Test
    void exhaustsAfterMaxRetriesPlusOneAttemptsWithExponentialWaits() {
        AtomicInteger calls = new AtomicInteger();
        BackoffStrategy strategy = new BackoffStrategy(settings(5), new ExponentialBackoffPolicy(), recordingSleeper, null);

        assertThatThrownBy(() -> strategy.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("timeout");
        }))
                .isInstanceOf(RetryExhaustedException.class)
                .hasCauseInstanceOf(IOException.class)
                .satisfies(e -> assertThat(((RetryExhaustedException) e).getAttempts()).isEqualTo(6));

        assertThat(calls).hasValue(6);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                Duration.ofSeconds(8), Duration.ofSeconds(16));
    }

    @Test
    void returnsFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();
        BackoffStrategy strategy = new BackoffStrategy(settings(5), null, recordingSleeper, null);

        String result = strategy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("flaky");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        AtomicInteger calls = new AtomicInteger();
        BackoffStrategy strategy = new BackoffStrategy(settings(0), null, recordingSleeper, null);

        assertThatThrownBy(() -> strategy.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("x");
        })).isInstanceOf(RetryExhaustedException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void nonRetryableFailureStopsWithoutSleeping() {
        AtomicInteger calls = new AtomicInteger();
        BackoffStrategy strategy = new BackoffStrategy(settings(5), null, recordingSleeper, null);

        assertThatThrownBy(() -> strategy.execute(() -> {
            calls.incrementAndGet();
            throw new NonRetryableException("400 bad request");
        })).isInstanceOf(NonRetryableException.class).hasMessage("400 bad request");
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void retryablePredicateRejectionIsWrapped() {
        BackoffSettings s = settings(5).toBuilder()
                .retryable(e -> !(e instanceof IllegalStateException))
                .build();
        BackoffStrategy strategy = new BackoffStrategy(s, null, recordingSleeper, null);

        assertThatThrownBy(() -> strategy.execute(() -> {
            throw new IllegalStateException("bad state");
        })).isInstanceOf(NonRetryableException.class).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void listenerSeesUpcomingAttemptNumber() {
        List<Integer> attempts = new ArrayList<>();
        BackoffStrategy strategy = new BackoffStrategy(settings(2), null, recordingSleeper,
                (attempt, failure, delay) -> attempts.add(attempt));

        assertThatThrownBy(() -> strategy.execute(() -> {
            throw new IOException("x");
        })).isInstanceOf(RetryExhaustedException.class);
        assertThat(attempts).containsExactly(2, 3);
    }

    @Test
    void cancelDuringWaitEndsPromptly() {
        CancellationToken token = CancellationToken.create();
        BackoffSettings longWait = settings(5).toBuilder()
                .baseDelay(Duration.ofSeconds(30))
                .maxDelay(Duration.ofSeconds(60))
                .build();
        BackoffStrategy strategy = new BackoffStrategy(longWait, null, null,
                (attempt, failure, delay) -> token.cancel("shutdown"));
        AtomicInteger calls = new AtomicInteger();
        long start = System.nanoTime();

        assertThatThrownBy(() -> strategy.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("x");
        }, token)).isInstanceOf(GuardCancelledException.class);
        assertThat(calls).hasValue(1);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void interruptedOperationBecomesCancellation() {
        BackoffStrategy strategy = new BackoffStrategy(settings(3), null, recordingSleeper, null);
        try {
            assertThatThrownBy(() -> strategy.execute(() -> {
                throw new InterruptedException("stop");
            })).isInstanceOf(GuardCancelledException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void invalidSettingsRejected() {
        assertThatThrownBy(() -> settings(-1).validate()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings(1).toBuilder().multiplier(0.5).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings(1).toBuilder().maxDelay(Duration.ofMillis(10)).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
