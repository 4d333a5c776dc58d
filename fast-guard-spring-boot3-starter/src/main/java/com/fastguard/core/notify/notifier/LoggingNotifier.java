package com.fastguard.core.notify.notifier;

import com.fastguard.core.spi.notify.Notifier;
import com.fastguard.core.spi.notify.NotifierTemplate;
import com.fastguard.model.NotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 始终启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    private final NotifierTemplate template;

    public LoggingNotifier(NotifierTemplate template) {
        this.template = template;
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotificationEvent event) {
        String title = template.renderTitle(event);
        switch (event.getSeverity()) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] {} msg={}, errorType={}, details={}",
                    event.getType(), title, event.getMessage(), event.getErrorType(), event.getDetails());
            case WARNING -> log.warn("[Notify-{}] {} msg={}, errorType={}, details={}",
                    event.getType(), title, event.getMessage(), event.getErrorType(), event.getDetails());
            default -> log.info("[Notify-{}] {} msg={}, details={}",
                    event.getType(), title, event.getMessage(), event.getDetails());
        }
    }
}
