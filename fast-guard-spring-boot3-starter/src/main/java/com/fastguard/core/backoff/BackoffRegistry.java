package com.fastguard.core.backoff;

import com.fastguard.config.GuardProperties;
import com.fastguard.core.spi.BackoffPolicy;
import com.fastguard.core.spi.failure.FailureDecider;
import com.fastguard.model.CallOptions;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 按 dependency 合并全局 / 依赖级 / 单次调用参数
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final GuardProperties props;

    private final Predicate<Throwable> defaultRetryable;

    public BackoffRegistry(GuardProperties props, @Nullable List<BackoffPolicy> discovered,
                           @Nullable FailureDecider failureDecider) {
        this.props = Objects.requireNonNull(props, "props");
        this.defaultRetryable = failureDecider == null ? e -> true : failureDecider::isRetryable;
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent("exponential", new ExponentialBackoffPolicy());
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略, 不存在则采用默认exponential策略
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get("exponential");
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get("exponential"));
    }

    /**
     * 生效参数: CallOptions 非空字段 > backoff-per-dependency 非空字段 > backoff
     */
    public BackoffSettings settingsFor(@Nullable String dependency, @Nullable CallOptions options) {
        GuardProperties.BackoffConfig cfg = props.getBackoff();
        BackoffSettings.BackoffSettingsBuilder b = BackoffSettings.builder()
                .strategy(cfg.getStrategy())
                .baseDelay(cfg.getBaseDelay())
                .maxDelay(cfg.getMaxDelay())
                .multiplier(cfg.getMultiplier())
                .maxRetries(cfg.getMaxRetries())
                .jitter(cfg.isJitter())
                .retryable(defaultRetryable);
        GuardProperties.BackoffOverride dep = overrideFor(dependency);
        if (dep != null) {
            if (dep.getStrategy() != null) b.strategy(dep.getStrategy());
            if (dep.getBaseDelay() != null) b.baseDelay(dep.getBaseDelay());
            if (dep.getMaxDelay() != null) b.maxDelay(dep.getMaxDelay());
            if (dep.getMultiplier() != null) b.multiplier(dep.getMultiplier());
            if (dep.getMaxRetries() != null) b.maxRetries(dep.getMaxRetries());
            if (dep.getJitter() != null) b.jitter(dep.getJitter());
        }
        if (options != null) {
            if (options.getMaxRetries() != null) b.maxRetries(options.getMaxRetries());
            if (options.getBaseDelay() != null) b.baseDelay(options.getBaseDelay());
            if (options.getMaxDelay() != null) b.maxDelay(options.getMaxDelay());
            if (options.getMultiplier() != null) b.multiplier(options.getMultiplier());
            if (options.getJitter() != null) b.jitter(options.getJitter());
            if (options.getRetryable() != null) b.retryable(options.getRetryable());
        }
        return b.build().validate();
    }

    public BackoffStrategy strategyFor(@Nullable String dependency, @Nullable CallOptions options,
                                       @Nullable BackoffStrategy.RetryListener listener) {
        BackoffSettings settings = settingsFor(dependency, options);
        return new BackoffStrategy(settings, resolve(settings.getStrategy()), null, listener);
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    @Nullable
    private GuardProperties.BackoffOverride overrideFor(@Nullable String dependency) {
        Map<String, GuardProperties.BackoffOverride> per = props.getBackoffPerDependency();
        return dependency == null || per == null ? null : per.get(dependency);
    }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        // 参数校验, 配置错误启动即失败
        settingsFor(null, null);
        if (props.getBackoffPerDependency() != null) {
            props.getBackoffPerDependency().keySet().forEach(dep -> settingsFor(dep, null));
        }
    }
}
