package com.fastguard.core.backoff;

import com.fastguard.core.cancel.CancellationToken;
import com.fastguard.core.spi.BackoffPolicy;
import com.fastguard.exception.GuardCancelledException;
import com.fastguard.exception.NonRetryableException;
import com.fastguard.exception.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 同步退避重试执行器
 * <p>
 * 最多执行 maxRetries + 1 次; 每次可重试失败后按 {@link BackoffPolicy} 计算等待并在调用线程上睡眠.
 * 不可重试的失败立即以 {@link NonRetryableException} 上抛, 预算用尽抛 {@link RetryExhaustedException}.
 * 睡眠经 {@link CancellationToken} 进行, 取消或截止时间到达以 {@link GuardCancelledException} 结束.
 */
public class BackoffStrategy {

    private static final Logger log = LoggerFactory.getLogger(BackoffStrategy.class);

    /** 可替换的睡眠方式, 默认在 token 上等待 */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration delay, CancellationToken token);
    }

    /** 每次重试前回调, attempt 为即将进行的尝试序号（从1开始） */
    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int attempt, Throwable failure, Duration delay);
    }

    private static final Sleeper TOKEN_SLEEPER = (delay, token) -> token.sleep(delay);

    private final BackoffSettings settings;
    private final BackoffPolicy policy;
    private final Sleeper sleeper;
    private final RetryListener listener;

    public BackoffStrategy(BackoffSettings settings) {
        this(settings, new ExponentialBackoffPolicy(), TOKEN_SLEEPER, null);
    }

    public BackoffStrategy(BackoffSettings settings, BackoffPolicy policy, Sleeper sleeper, RetryListener listener) {
        this.settings = Objects.requireNonNull(settings, "settings").validate();
        this.policy = policy == null ? new ExponentialBackoffPolicy() : policy;
        this.sleeper = sleeper == null ? TOKEN_SLEEPER : sleeper;
        this.listener = listener;
    }

    public <T> T execute(Callable<T> operation) {
        return execute(operation, CancellationToken.none());
    }

    public <T> T execute(Callable<T> operation, CancellationToken token) {
        Objects.requireNonNull(operation, "operation");
        CancellationToken t = token == null ? CancellationToken.none() : token;
        Predicate<Throwable> retryable = settings.getRetryable() == null ? e -> true : settings.getRetryable();
        int maxAttempts = settings.maxAttempts();

        Exception last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            t.throwIfCancelled();
            try {
                return operation.call();
            } catch (GuardCancelledException | NonRetryableException e) {
                throw e;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new GuardCancelledException("interrupted during attempt " + (attempt + 1), ie);
            } catch (Exception e) {
                if (!retryable.test(e)) {
                    log.debug("[Backoff] non-retryable failure on attempt {}: {}", attempt + 1, e.toString());
                    throw new NonRetryableException(e);
                }
                last = e;
                if (attempt + 1 >= maxAttempts) {
                    break;
                }
                Duration delay = policy.delay(attempt, settings);
                log.debug("[Backoff] attempt {}/{} failed, retry in {}ms: {}",
                        attempt + 1, maxAttempts, delay.toMillis(), e.toString());
                fireRetry(attempt + 2, e, delay);
                sleeper.sleep(delay, t);
            }
        }
        throw new RetryExhaustedException(maxAttempts, last);
    }

    public BackoffSettings getSettings() {
        return settings;
    }

    private void fireRetry(int nextAttempt, Throwable failure, Duration delay) {
        if (listener == null) {
            return;
        }
        try {
            listener.onRetry(nextAttempt, failure, delay);
        } catch (RuntimeException e) {
            log.warn("[Backoff] retry listener failed", e);
        }
    }
}
