package com.fastguard.core.notify.ratelimit;

import com.fastguard.core.spi.notify.NotifierFilter;
import com.fastguard.model.NotificationEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存窗口节流
 * 按 errorType + severity 分桶, 每个桶在固定窗口内最多放行 threshold 条; 没有 errorType 的事件不节流
 */
public class ThrottleFilter implements NotifierFilter {

    /** 桶数超过该值时顺带清理过期桶 */
    private static final int PRUNE_THRESHOLD = 1024;

    private final long windowMs;

    private final int threshold;

    private final Clock clock;

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    public ThrottleFilter(Duration window, int threshold) {
        this(window, threshold, Clock.systemUTC());
    }

    public ThrottleFilter(Duration window, int threshold, Clock clock) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("guard.notify.throttle.window must be > 0");
        }
        if (threshold < 1) {
            throw new IllegalArgumentException("guard.notify.throttle.threshold must be >= 1");
        }
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.clock = clock;
    }

    @Override
    public boolean allow(NotificationEvent event) {
        if (event.getErrorType() == null || event.getErrorType().isBlank()) {
            return true;
        }
        long now = clock.millis();
        if (windows.size() > PRUNE_THRESHOLD) {
            windows.values().removeIf(w -> now - w.start >= windowMs);
        }
        String key = event.getErrorType() + "_" + event.getSeverity();
        // compute 保证同一个桶的判断与计数是原子的
        Window w = windows.compute(key, (k, cur) -> {
            if (cur == null || now - cur.start >= windowMs) {
                return new Window(now, 1);
            }
            return new Window(cur.start, cur.count + 1);
        });
        return w.count <= threshold;
    }

    private static final class Window {
        final long start;
        final int count;

        Window(long start, int count) {
            this.start = start;
            this.count = count;
        }
    }
}
