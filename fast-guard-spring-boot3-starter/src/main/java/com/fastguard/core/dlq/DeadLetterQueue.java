package com.fastguard.core.dlq;

import com.fastguard.config.GuardDeadLetterProperties;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.core.notify.AdminNotifier;
import com.fastguard.core.notify.NotificationEvents;
import com.fastguard.core.spi.PayloadSerializer;
import com.fastguard.core.spi.dlq.DeadLetterStore;
import com.fastguard.core.spi.dlq.Reprocessor;
import com.fastguard.model.DeadLetterEntry;
import com.fastguard.model.ErrorInfo;
import com.fastguard.model.enums.DeadLetterStatus;
import com.fastguard.model.enums.ReprocessOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 死信队列
 * <p>
 * 写入永不抛异常: 失败记日志、计数并发 DLQ_WRITE_FAILED 告警, 返回空.
 * 拉取后条目进入 IN_FLIGHT, 租约到期未处理会重新可见, 因此重处理逻辑必须幂等.
 */
public class DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);

    private static final int MAX_ERROR_LEN = 4000;

    /** payload 无法序列化为 JSON 时写入 errorInfo 的标记 */
    public static final String ATTR_PAYLOAD_FORMAT = "payloadFormat";

    public static final String PAYLOAD_FORMAT_TO_STRING = "toString";

    private final DeadLetterStore store;

    private final PayloadSerializer serializer;

    private final GuardDeadLetterProperties props;

    private final GuardMetrics metrics;

    /** 可为空, 单独使用 DLQ 时不发告警 */
    @Nullable
    private final AdminNotifier notifier;

    private final Clock clock;

    public DeadLetterQueue(DeadLetterStore store, PayloadSerializer serializer, GuardDeadLetterProperties props,
                           GuardMetrics metrics, @Nullable AdminNotifier notifier, Clock clock) {
        this.store = store;
        this.serializer = serializer;
        this.props = props;
        this.metrics = metrics;
        this.notifier = notifier;
        this.clock = clock;
        if (props.getMaxReprocessAttempts() < 1) {
            throw new IllegalArgumentException("guard.dlq.max-reprocess-attempts must be >= 1");
        }
        if (props.getVisibilityTimeout() == null || props.getVisibilityTimeout().isNegative()) {
            throw new IllegalArgumentException("guard.dlq.visibility-timeout must be >= 0");
        }
    }

    public Optional<String> sendToDlq(Object payload, ErrorInfo errorInfo) {
        return sendToDlq(null, payload, errorInfo);
    }

    /**
     * 写入一条 PENDING 死信
     * @return 死信 id; 写入失败为空
     */
    public Optional<String> sendToDlq(@Nullable String dependency, Object payload, ErrorInfo errorInfo) {
        try {
            Instant now = clock.instant();
            String body;
            ErrorInfo info = errorInfo;
            try {
                body = serializer.serialize(payload);
            } catch (RuntimeException se) {
                // payload 对调用方是不透明的, 不能因为写不成 JSON 就丢掉这条死信
                body = describe(payload);
                info = withPayloadFallback(errorInfo, se, now);
                log.warn("[DLQ] payload type={} not serializable, stored as toString err={}",
                        payload.getClass().getName(), se.toString());
            }
            DeadLetterEntry entry = DeadLetterEntry.builder()
                    .messageId(UUID.randomUUID().toString())
                    .dependency(dependency)
                    .payload(body)
                    .errorInfo(info)
                    .attemptCount(0)
                    .status(DeadLetterStatus.PENDING)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            store.save(entry);
            metrics.incDlqWritten();
            log.info("[DLQ] written id={} dependency={} kind={} store={}", entry.getMessageId(), dependency,
                    info == null ? null : info.getKind(), store.name());
            return Optional.of(entry.getMessageId());
        } catch (RuntimeException e) {
            metrics.incDlqWriteFailed();
            log.error("[DLQ] write failed dependency={} store={}", dependency, store.name(), e);
            if (notifier != null) {
                notifier.sendNotification(NotificationEvents.dlqWriteFailed(dependency, e, clock));
            }
            return Optional.empty();
        }
    }

    /**
     * 认领至多 maxMessages 条, 置 IN_FLIGHT 并设置租约
     */
    public List<DeadLetterEntry> receiveFromDlq(int maxMessages) {
        if (maxMessages <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<DeadLetterEntry> claimed = store.claim(maxMessages, now, now.plus(props.getVisibilityTimeout()));
        if (!claimed.isEmpty()) {
            log.debug("[DLQ] received {} entries", claimed.size());
        }
        return claimed;
    }

    /**
     * 运维确认已人工处理, 删除条目
     */
    public boolean acknowledge(String messageId) {
        boolean removed = store.delete(messageId);
        log.info("[DLQ] acknowledge id={} removed={}", messageId, removed);
        return removed;
    }

    public ReprocessOutcome reprocessMessage(String messageId, Reprocessor reprocessor) {
        Optional<DeadLetterEntry> found = store.find(messageId);
        if (found.isEmpty()) {
            return ReprocessOutcome.NOT_FOUND;
        }
        DeadLetterEntry entry = found.get();
        if (entry.getStatus().isTerminal()) {
            return ReprocessOutcome.SKIPPED;
        }
        Instant now = clock.instant();
        if (entry.getStatus() == DeadLetterStatus.PENDING) {
            // 先占住, 避免与 receive 的消费者重复处理
            entry.setStatus(DeadLetterStatus.IN_FLIGHT);
            entry.setVisibleAfter(now.plus(props.getVisibilityTimeout()));
            entry.setUpdatedAt(now);
            if (!store.update(entry)) {
                log.debug("[DLQ] reprocess id={} lost claim race", messageId);
                return ReprocessOutcome.SKIPPED;
            }
        }
        return reprocess(entry, reprocessor);
    }

    /**
     * 拉取一批并逐条重处理
     * @return 各结果计数
     */
    public Map<ReprocessOutcome, Integer> reprocessPending(int maxMessages, Reprocessor reprocessor) {
        Map<ReprocessOutcome, Integer> counts = new EnumMap<>(ReprocessOutcome.class);
        for (DeadLetterEntry entry : receiveFromDlq(maxMessages)) {
            counts.merge(reprocess(entry, reprocessor), 1, Integer::sum);
        }
        return counts;
    }

    public Optional<DeadLetterEntry> get(String messageId) {
        return store.find(messageId);
    }

    public List<DeadLetterEntry> list(@Nullable DeadLetterStatus status, int limit) {
        return store.list(status, limit);
    }

    public Map<DeadLetterStatus, Long> countByStatus() {
        return store.countByStatus();
    }

    public int purge() {
        int n = store.purge();
        log.warn("[DLQ] purged {} entries from {}", n, store.name());
        return n;
    }

    public DeadLetterStore getStore() {
        return store;
    }

    /**
     * entry 须为当前持有的 IN_FLIGHT 条目
     */
    private ReprocessOutcome reprocess(DeadLetterEntry entry, Reprocessor reprocessor) {
        String failure;
        try {
            if (reprocessor.reprocess(entry)) {
                entry.setStatus(DeadLetterStatus.REPROCESSED);
                entry.setVisibleAfter(null);
                entry.setUpdatedAt(clock.instant());
                if (!commit(entry)) {
                    return ReprocessOutcome.SKIPPED;
                }
                metrics.incDlqReprocessed();
                log.info("[DLQ] reprocessed id={} dependency={}", entry.getMessageId(), entry.getDependency());
                return ReprocessOutcome.REPROCESSED;
            }
            failure = "reprocessor returned false";
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            failure = "interrupted";
        } catch (Exception e) {
            failure = e.getClass().getName() + ": " + e.getMessage();
            log.warn("[DLQ] reprocess failed id={} err={}", entry.getMessageId(), e.toString());
        }

        entry.setAttemptCount(entry.getAttemptCount() + 1);
        entry.setLastReprocessError(truncate(failure));
        entry.setVisibleAfter(null);
        entry.setUpdatedAt(clock.instant());
        if (entry.getAttemptCount() >= props.getMaxReprocessAttempts()) {
            entry.setStatus(DeadLetterStatus.DEAD);
            if (!commit(entry)) {
                return ReprocessOutcome.SKIPPED;
            }
            metrics.incDlqDead();
            log.error("[DLQ] give up id={} dependency={} attempts={}", entry.getMessageId(),
                    entry.getDependency(), entry.getAttemptCount());
            if (notifier != null) {
                notifier.sendNotification(NotificationEvents.deadLetter(entry, failure, clock));
            }
            return ReprocessOutcome.DEAD;
        }
        entry.setStatus(DeadLetterStatus.PENDING);
        return commit(entry) ? ReprocessOutcome.REQUEUED : ReprocessOutcome.SKIPPED;
    }

    /**
     * @return false 表示版本冲突, 本次结果未落盘
     */
    private boolean commit(DeadLetterEntry entry) {
        if (store.update(entry)) {
            return true;
        }
        // 租约过期后被其他消费者重新认领, 以对方的处理为准
        log.warn("[DLQ] concurrent modification id={} status={} not persisted",
                entry.getMessageId(), entry.getStatus());
        return false;
    }

    private ErrorInfo withPayloadFallback(@Nullable ErrorInfo errorInfo, RuntimeException cause, Instant now) {
        ErrorInfo info = errorInfo == null
                ? ErrorInfo.builder().timestamp(now).build()
                : errorInfo.toBuilder().attributes(errorInfo.getAttributes() == null
                        ? new LinkedHashMap<>() : new LinkedHashMap<>(errorInfo.getAttributes())).build();
        Throwable root = cause.getCause() == null ? cause : cause.getCause();
        return info.with(ATTR_PAYLOAD_FORMAT, PAYLOAD_FORMAT_TO_STRING)
                .with("payloadError", root.getClass().getName());
    }

    private static String describe(Object payload) {
        try {
            return String.valueOf(payload);
        } catch (RuntimeException e) {
            return payload.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(payload));
        }
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}
