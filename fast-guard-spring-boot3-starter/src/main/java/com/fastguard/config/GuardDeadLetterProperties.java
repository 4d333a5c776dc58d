package com.fastguard.config;

import com.fastguard.model.enums.DeadLetterBackend;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * guard:
 *   dlq:
 *     backend: local-file
 *     local-file-path: ./local_dlq.jsonl
 *     visibility-timeout: 30s
 *     max-reprocess-attempts: 3
 *     capture-on-circuit-open: true
 */
@Data
@ConfigurationProperties(prefix = "guard.dlq")
public class GuardDeadLetterProperties {

    private DeadLetterBackend backend = DeadLetterBackend.LOCAL_FILE;

    private String localFilePath = "./local_dlq.jsonl";

    /** receive 后的租约时长, 过期未确认则重新可见 */
    private Duration visibilityTimeout = Duration.ofSeconds(30);

    /** 重处理失败达到该次数后转 DEAD */
    private int maxReprocessAttempts = 3;

    /** 熔断拒绝时是否也写入死信 */
    private boolean captureOnCircuitOpen = true;

    /** 启动时压缩本地文件 */
    private boolean compactOnStartup = false;
}
