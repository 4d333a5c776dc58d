package com.fastguard.core.backoff;

import com.fastguard.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * delay_i = min(max, base * multiplier^i), 开启抖动时在 [0, delay_i] 内均匀取值
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration delay(int attempt, BackoffSettings settings) {
        long ideal = rawDelayMillis(attempt, settings);
        if (settings.isJitter() && ideal > 0) {
            return Duration.ofMillis(ThreadLocalRandom.current().nextLong(ideal + 1));
        }
        return Duration.ofMillis(ideal);
    }

    /** 抖动前的等待 */
    static long rawDelayMillis(int attempt, BackoffSettings settings) {
        long base = settings.getBaseDelay().toMillis();
        long max = settings.getMaxDelay().toMillis();
        double pow = Math.pow(settings.getMultiplier(), Math.max(0, attempt));
        double ideal = base * pow;
        // pow 溢出为 Infinity 时同样取 max
        return ideal >= max ? max : (long) ideal;
    }
}
