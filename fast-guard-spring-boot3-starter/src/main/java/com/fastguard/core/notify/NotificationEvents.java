package com.fastguard.core.notify;

import com.fastguard.exception.CircuitOpenException;
import com.fastguard.model.DeadLetterEntry;
import com.fastguard.model.NotificationEvent;
import com.fastguard.model.enums.NotifyEventType;
import com.fastguard.model.enums.Severity;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 各类告警事件的构造入口; application / environment 由 AdminNotifier 补齐
 */
public final class NotificationEvents {

    private static final int MAX_ERROR_LEN = 4000;

    public static final String HEALTH_CHECK_ERROR_TYPE = "health_check";

    private NotificationEvents() {}

    public static NotificationEvent custom(String message, Map<String, Object> details,
                                           Severity severity, String errorType, Clock clock) {
        return NotificationEvent.builder()
                .type(NotifyEventType.CUSTOM)
                .severity(severity == null ? Severity.ERROR : severity)
                .message(message)
                .details(details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details))
                .errorType(errorType)
                .timestamp(now(clock))
                .build();
    }

    public static NotificationEvent circuitOpen(String dependency, CircuitOpenException e, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("dependency", dependency);
        attrs.put("state", e.getState());
        return NotificationEvent.builder()
                .type(NotifyEventType.CIRCUIT_OPEN)
                .severity(Severity.WARNING)
                .message("Circuit open for " + dependency + ", call rejected")
                .details(attrs)
                .errorType("circuit_open:" + dependency)
                .timestamp(now(clock))
                .build();
    }

    public static NotificationEvent retryExhausted(String dependency, int attempts, Throwable lastError,
                                                   String payloadSnapshot, String deadLetterId, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("dependency", dependency);
        attrs.put("attempts", attempts);
        attrs.put("error", truncate(toError(lastError)));
        attrs.put("payload", payloadSnapshot);
        if (deadLetterId != null) {
            attrs.put("deadLetterId", deadLetterId);
        }
        return NotificationEvent.builder()
                .type(NotifyEventType.RETRY_EXHAUSTED)
                .severity(Severity.ERROR)
                .message("Call to " + dependency + " failed after " + attempts + " attempts")
                .details(attrs)
                .errorType("retry_exhausted:" + dependency)
                .timestamp(now(clock))
                .build();
    }

    public static NotificationEvent deadLetter(DeadLetterEntry entry, String reason, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("messageId", entry.getMessageId());
        attrs.put("dependency", entry.getDependency());
        attrs.put("attemptCount", entry.getAttemptCount());
        attrs.put("reason", truncate(reason));
        return NotificationEvent.builder()
                .type(NotifyEventType.DEAD_LETTER)
                .severity(Severity.ERROR)
                .message("Dead letter " + entry.getMessageId() + " gave up after "
                        + entry.getAttemptCount() + " reprocess attempts")
                .details(attrs)
                .errorType("dead_letter:" + entry.getDependency())
                .timestamp(now(clock))
                .build();
    }

    public static NotificationEvent dlqWriteFailed(String dependency, Throwable e, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("dependency", dependency);
        attrs.put("error", truncate(toError(e)));
        return NotificationEvent.builder()
                .type(NotifyEventType.DLQ_WRITE_FAILED)
                .severity(Severity.CRITICAL)
                .message("Failed to write dead letter for " + dependency)
                .details(attrs)
                .errorType("dlq_write_failed")
                .timestamp(now(clock))
                .build();
    }

    /**
     * 健康: INFO 且不带 errorType（不节流）; 异常: ERROR + health_check
     */
    public static NotificationEvent healthCheck(boolean healthy, Map<String, Object> details, Clock clock) {
        Instant ts = now(clock);
        Map<String, Object> attrs = details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
        attrs.put("is_healthy", healthy);
        attrs.put("timestamp", ts.toString());
        return NotificationEvent.builder()
                .type(NotifyEventType.HEALTH_CHECK)
                .severity(healthy ? Severity.INFO : Severity.ERROR)
                .message(healthy ? "Health check: healthy" : "Health check failed")
                .details(attrs)
                .errorType(healthy ? null : HEALTH_CHECK_ERROR_TYPE)
                .timestamp(ts)
                .build();
    }

    /**
     * payload 摘要, 超长截断并标注原长度
     */
    public static String snapshot(String payload, int maxLen) {
        if (payload == null) return null;
        if (maxLen <= 0 || payload.length() <= maxLen) return payload;
        return payload.substring(0, maxLen) + "...(" + payload.length() + " chars)";
    }

    static String toError(Throwable e) {
        if (e == null) return null;
        String msg = e.getClass().getName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        StringBuilder sb = new StringBuilder(msg);
        StackTraceElement[] stack = e.getStackTrace();
        // 只取前10行，避免过长
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) sb.append("\n  at ").append(stack[i]);
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }

    private static Instant now(Clock clock) {
        return Instant.now(clock);
    }
}
