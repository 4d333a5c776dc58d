package com.fastguard.core.backoff;

import com.fastguard.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略, 每次等待 baseDelay（可选抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration delay(int attempt, BackoffSettings settings) {
        long delay = Math.min(settings.getBaseDelay().toMillis(), settings.getMaxDelay().toMillis());
        if (settings.isJitter() && delay > 0) {
            delay = ThreadLocalRandom.current().nextLong(delay + 1);
        }
        return Duration.ofMillis(delay);
    }
}
