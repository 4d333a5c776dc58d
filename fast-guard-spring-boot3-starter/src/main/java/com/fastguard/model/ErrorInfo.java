package com.fastguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 失败信息, 随死信一起落盘
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ErrorInfo {

    private static final int MAX_MESSAGE_LEN = 4000;

    /** 分类码, 如 RETRY_EXHAUSTED / CIRCUIT_OPEN */
    private String kind;

    /** 可被截断 */
    private String message;

    private Instant timestamp;

    /** 额外字段：异常类型、尝试次数、依赖名等 */
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    public static ErrorInfo of(String kind, Throwable e, Clock clock) {
        Map<String, String> attrs = new LinkedHashMap<>();
        if (e != null) {
            attrs.put("exception", e.getClass().getName());
        }
        return ErrorInfo.builder()
                .kind(kind)
                .message(truncate(e == null ? null : (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage())))
                .timestamp(Instant.now(clock))
                .attributes(attrs)
                .build();
    }

    public ErrorInfo with(String key, Object value) {
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        attributes.put(key, value == null ? null : String.valueOf(value));
        return this;
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_MESSAGE_LEN ? s.substring(0, MAX_MESSAGE_LEN) : s;
    }
}
