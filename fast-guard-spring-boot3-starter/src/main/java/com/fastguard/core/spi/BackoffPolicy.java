package com.fastguard.core.spi;

import com.fastguard.core.backoff.BackoffSettings;

import java.time.Duration;

/**
 * 退避策略（计算两次尝试之间的等待）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算等待时长
     * @param attempt  刚失败的是第几次尝试（从0开始）
     * @param settings 本次调用生效的退避参数
     * @return 等待时长, 不超过 settings.maxDelay
     */
    Duration delay(int attempt, BackoffSettings settings);
}
