package com.fastguard.core.notify.template;

import com.fastguard.core.spi.notify.NotifierTemplate;
import com.fastguard.model.NotificationEvent;

import java.util.Map;

/**
 * 纯文本模板
 * <pre>
 * [ERROR] my-app/production RETRY_EXHAUSTED
 * message: ...
 * time: 2024-01-01T00:00:00Z
 * errorType: retry_exhausted:openai
 * details:
 *   dependency: openai
 * </pre>
 */
public class DefaultNotifierTemplate implements NotifierTemplate {

    @Override
    public String renderTitle(NotificationEvent event) {
        return "[" + event.getSeverity() + "] "
                + nvl(event.getApplication()) + "/" + nvl(event.getEnvironment()) + " "
                + event.getType();
    }

    @Override
    public String renderBody(NotificationEvent event) {
        StringBuilder sb = new StringBuilder(renderTitle(event)).append('\n');
        sb.append("message: ").append(nvl(event.getMessage())).append('\n');
        sb.append("time: ").append(event.getTimestamp()).append('\n');
        if (event.getErrorType() != null) {
            sb.append("errorType: ").append(event.getErrorType()).append('\n');
        }
        Map<String, Object> details = event.getDetails();
        if (details != null && !details.isEmpty()) {
            sb.append("details:");
            details.forEach((k, v) -> sb.append("\n  ").append(k).append(": ").append(v));
        }
        return sb.toString();
    }

    private static String nvl(String s) {
        return s == null ? "-" : s;
    }
}
