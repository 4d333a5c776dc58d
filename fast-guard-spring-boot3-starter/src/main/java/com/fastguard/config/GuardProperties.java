package com.fastguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * guard:
 *   enabled: true
 *   circuit-breaker:
 *     failure-threshold: 5
 *     recovery-timeout: 60s
 *     permitted-calls-in-half-open: 1
 *   cb-per-dependency:
 *     openai: { failure-threshold: 3, recovery-timeout: 30s }
 *   backoff:
 *     strategy: exponential
 *     base-delay: 1s
 *     max-delay: 60s
 *     multiplier: 2.0
 *     max-retries: 5
 *     jitter: true
 *   backoff-per-dependency:
 *     twilio: { max-retries: 3 }
 *   tx:
 *     propagation: REQUIRED
 *     timeout-seconds: 10
 */
@Data
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {
    /** 开关 */
    private boolean enabled = true;

    /** 默认配置（可被 dependency 覆盖） */
    private CbConfig circuitBreaker = new CbConfig();
    private BackoffConfig backoff = new BackoffConfig();

    /** 按 dependency 覆盖熔断配置, 覆盖项整体替换默认配置 */
    private Map<String, CbConfig> cbPerDependency = new LinkedHashMap<>();

    /** 按 dependency 覆盖退避配置, 只覆盖写了的字段, 其余沿用 backoff */
    private Map<String, BackoffOverride> backoffPerDependency = new LinkedHashMap<>();

    /** 数据库死信使用的编程式事务 */
    private Tx tx = new Tx();

    @Data
    public static class CbConfig {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private int permittedCallsInHalfOpen = 1;
    }

    @Data
    public static class BackoffConfig {
        /** exponential / fixed / spi:{name} */
        private String strategy = "exponential";
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxRetries = 5;
        private boolean jitter = true;
    }

    /**
     * 字段为空表示沿用全局 backoff
     */
    @Data
    public static class BackoffOverride {
        private String strategy;
        private Duration baseDelay;
        private Duration maxDelay;
        private Double multiplier;
        private Integer maxRetries;
        private Boolean jitter;
    }

    @Data
    public static class Tx {
        private Propagation propagation = Propagation.REQUIRED;
        private boolean readOnly = false;
        private Isolation isolation = Isolation.DEFAULT;
        /** 超时（秒，<=0 表示不设置） */
        private int timeoutSeconds = 0;
    }
}
