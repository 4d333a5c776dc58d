package com.fastguard.core;

import com.fastguard.config.GuardDeadLetterProperties;
import com.fastguard.config.GuardNotifierProperties;
import com.fastguard.config.GuardProperties;
import com.fastguard.core.dlq.DeadLetterQueue;
import com.fastguard.core.dlq.store.LocalFileDeadLetterStore;
import com.fastguard.core.notify.AsyncNotifyingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 启动打印配置、按需压缩本地死信文件; 停止时在 shutdown-await 内发完排队中的告警
 */
public class GuardLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GuardLifecycle.class);

    private final GuardProperties props;

    private final GuardDeadLetterProperties dlqProps;

    private final GuardNotifierProperties notifyProps;

    private final DeadLetterQueue dlq;

    private final AsyncNotifyingService notifyingService;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GuardLifecycle(GuardProperties props, GuardDeadLetterProperties dlqProps,
                          GuardNotifierProperties notifyProps, DeadLetterQueue dlq,
                          AsyncNotifyingService notifyingService) {
        this.props = props;
        this.dlqProps = dlqProps;
        this.notifyProps = notifyProps;
        this.dlq = dlq;
        this.notifyingService = notifyingService;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ FastGuard starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ cb.failureThreshold   : {}", props.getCircuitBreaker().getFailureThreshold());
            log.info("│ cb.recoveryTimeout    : {} ms", props.getCircuitBreaker().getRecoveryTimeout().toMillis());
            log.info("│ cb.perDependency      : {}", props.getCbPerDependency() == null ? "-" : props.getCbPerDependency().keySet());
            log.info("│ backoff.strategy      : {}", props.getBackoff().getStrategy());
            log.info("│ backoff.maxRetries    : {}", props.getBackoff().getMaxRetries());
            log.info("│ backoff.base/max      : {} / {} ms", props.getBackoff().getBaseDelay().toMillis(),
                    props.getBackoff().getMaxDelay().toMillis());
            log.info("│ dlq.store             : {}", dlq.getStore().name());
            log.info("│ dlq.visibilityTimeout : {} ms", dlqProps.getVisibilityTimeout().toMillis());
            log.info("│ notify.enabled        : {}", notifyProps.isEnabled());
            log.info("│ notify.channel        : {}", notifyProps.getChannel());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (RuntimeException e) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Guard] failed to render startup banner: {}", e.toString());
        }
        if (dlqProps.isCompactOnStartup() && dlq.getStore() instanceof LocalFileDeadLetterStore) {
            ((LocalFileDeadLetterStore) dlq.getStore()).compact();
        }
        try {
            log.info("[Guard] started, dlq counts={}", dlq.countByStatus());
        } catch (RuntimeException e) {
            log.warn("[Guard] started, dlq store {} not readable: {}", dlq.getStore().name(), e.toString());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("[Guard] stopping, flushing notifications (await {} ms)", notifyProps.getShutdownAwait().toMillis());
        try {
            notifyingService.shutdown(notifyProps.getShutdownAwait());
        } finally {
            log.info("[Guard] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
