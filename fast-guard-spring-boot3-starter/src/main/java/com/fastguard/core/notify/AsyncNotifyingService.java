package com.fastguard.core.notify;

import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.core.spi.notify.Notifier;
import com.fastguard.core.spi.notify.NotifierFilter;
import com.fastguard.core.spi.notify.NotifierRouter;
import com.fastguard.model.NotificationEvent;
import com.fastguard.model.enums.DispatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 异步派发
 * 通过节流、路由、异步执行通知; 单通道最多尝试 3 次, 失败只记日志与指标
 */
public class AsyncNotifyingService {

    private static final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private static final int MAX_ATTEMPTS = 3;

    private static final long MAX_PAUSE_MS = 4000;

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final NotifierFilter filter;

    private final GuardMetrics metrics;

    /** 首次重试前的等待, 之后翻倍 */
    private final long initialPauseMs;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter, GuardMetrics metrics) {
        this(exec, router, filter, metrics, 200);
    }

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter,
                                 GuardMetrics metrics, long initialPauseMs) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.metrics = metrics;
        this.initialPauseMs = initialPauseMs;
    }

    public DispatchResult fire(NotificationEvent event) {
        if (filter != null && !filter.allow(event)) {
            metrics.incNotifySuppressed();
            log.debug("[Notify] throttled type={} errorType={} severity={}",
                    event.getType(), event.getErrorType(), event.getSeverity());
            return DispatchResult.THROTTLED;
        }
        try {
            exec.execute(() -> dispatch(event));
            return DispatchResult.ACCEPTED;
        } catch (RejectedExecutionException e) {
            metrics.incNotifyFailed();
            log.warn("[Notify] dispatch queue rejected type={} severity={} msg={}",
                    event.getType(), event.getSeverity(), event.getMessage());
            return DispatchResult.REJECTED;
        }
    }

    private void dispatch(NotificationEvent event) {
        List<Notifier> notifiers = router.route(event);
        for (Notifier n : notifiers) {
            try {
                int attempt = 0;
                long backoff = initialPauseMs;
                while (true) {
                    try {
                        n.notify(event);
                        break;
                    } catch (Exception e) {
                        if (++ attempt >= MAX_ATTEMPTS) {
                            throw e;
                        }
                        Thread.sleep(backoff);
                        // 指数退避
                        backoff = Math.min(backoff * 2, MAX_PAUSE_MS);
                    }
                }
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                log.warn("[Notify] interrupted, channel={} event={} dropped", n.name(), event.getType());
                return;
            } catch (Exception e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), event.getType(), e);
            }
        }
    }

    /**
     * 停止接收新事件, 在 await 内尽量发完队列中的事件
     */
    public void shutdown(Duration await) {
        exec.shutdown();
        try {
            if (!exec.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = exec.shutdownNow();
                log.warn("[Notify] shutdown timeout after {}ms, dropped {} pending notifications",
                        await.toMillis(), dropped.size());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
        }
    }
}
