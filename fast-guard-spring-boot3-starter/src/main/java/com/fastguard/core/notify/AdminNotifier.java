package com.fastguard.core.notify;

import com.fastguard.config.GuardNotifierProperties;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.model.NotificationEvent;
import com.fastguard.model.enums.DispatchResult;
import com.fastguard.model.enums.Severity;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * 运维告警入口
 * 补齐 application / environment 后交给 {@link AsyncNotifyingService}; 任何情况下都不向调用方抛异常
 */
public class AdminNotifier {

    private static final Logger log = LoggerFactory.getLogger(AdminNotifier.class);

    private final AsyncNotifyingService service;

    private final GuardNotifierProperties props;

    private final GuardMetrics metrics;

    private final Clock clock;

    public AdminNotifier(AsyncNotifyingService service, GuardNotifierProperties props,
                         GuardMetrics metrics, Clock clock) {
        this.service = service;
        this.props = props;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @return true 已受理; false 通知关闭、被节流或队列已满
     */
    public boolean sendNotification(String message, Map<String, Object> details, Severity severity, String errorType) {
        return sendNotification(NotificationEvents.custom(message, details, severity, errorType, clock));
    }

    public boolean sendNotification(NotificationEvent event) {
        return submit(event) == DispatchResult.ACCEPTED;
    }

    /**
     * 健康检查结果上报, 只有失败会被节流
     */
    public boolean sendHealthCheckNotification(boolean healthy, Map<String, Object> details) {
        return sendNotification(NotificationEvents.healthCheck(healthy, details, clock));
    }

    public BatchResult sendBatchNotifications(List<NotificationEvent> events) {
        int accepted = 0, throttled = 0, failed = 0;
        if (events != null) {
            for (NotificationEvent e : events) {
                switch (submit(e)) {
                    case ACCEPTED -> accepted++;
                    case THROTTLED -> throttled++;
                    default -> failed++;
                }
            }
        }
        int total = events == null ? 0 : events.size();
        log.debug("[Notify] batch total={} accepted={} throttled={} failed={}", total, accepted, throttled, failed);
        return new BatchResult(total, accepted, throttled, failed);
    }

    public Clock getClock() {
        return clock;
    }

    private DispatchResult submit(NotificationEvent event) {
        if (!props.isEnabled() || event == null) {
            return DispatchResult.REJECTED;
        }
        try {
            if (event.getApplication() == null) {
                event.setApplication(props.getApplication());
            }
            if (event.getEnvironment() == null) {
                event.setEnvironment(props.getEnvironment());
            }
            if (event.getTimestamp() == null) {
                event.setTimestamp(clock.instant());
            }
            if (event.getSeverity() == null) {
                event.setSeverity(Severity.ERROR);
            }
            return service.fire(event);
        } catch (RuntimeException e) {
            metrics.incNotifyFailed();
            log.error("[Notify] submit failed type={} msg={}", event.getType(), event.getMessage(), e);
            return DispatchResult.REJECTED;
        }
    }

    @Value
    public static class BatchResult {
        int total;
        int accepted;
        int throttled;
        int failed;
    }
}
