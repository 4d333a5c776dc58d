package com.fastguard.model;

import com.fastguard.model.enums.NotifyEventType;
import com.fastguard.model.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 告警事件, 不落库, 尽力投递
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationEvent {

    private NotifyEventType type;

    private Severity severity;

    private String message;

    /** 详细字段, 可被截断/脱敏 */
    private Map<String, Object> details;

    /** 节流维度, 为空则不节流 */
    private String errorType;

    private Instant timestamp;

    private String application;

    private String environment;
}
