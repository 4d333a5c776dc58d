package com.fastguard.core.breaker;

import com.fastguard.config.GuardProperties;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.exception.NonRetryableException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * dependency -> CircuitBreaker, 首次使用时按配置创建; 每个依赖一个独立的 resilience4j 状态机, 注册表本身无全局锁
 */
public class CircuitBreakerRegistry implements InitializingBean {

    private final GuardProperties props;
    private final Clock clock;
    @Nullable
    private final GuardMetrics metrics;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();

    /** 对所有熔断器生效, 包括之后才创建的 */
    private final List<CircuitTransitionListener> listeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry(GuardProperties props, Clock clock, @Nullable GuardMetrics metrics) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.metrics = metrics;
    }

    public CircuitBreaker get(String dependency) {
        return cbCache.computeIfAbsent(dependency, this::buildCb);
    }

    public Optional<CircuitBreaker> find(String dependency) {
        return Optional.ofNullable(cbCache.get(dependency));
    }

    public Collection<CircuitBreaker> all() {
        return Collections.unmodifiableCollection(cbCache.values());
    }

    /**
     * 注册全局迁移监听; 已创建的熔断器同样补挂
     */
    public void addListener(CircuitTransitionListener listener) {
        listeners.add(listener);
        cbCache.values().forEach(cb -> cb.addListener(listener));
    }

    private CircuitBreaker buildCb(String dependency) {
        GuardProperties.CbConfig c = configFor(dependency);
        // 被 FailureDecider 判为不可重试的异常不算依赖故障
        Predicate<Throwable> ignore = e -> e instanceof NonRetryableException;
        CircuitBreaker cb = new CircuitBreaker(dependency, c.getFailureThreshold(), c.getRecoveryTimeout(),
                c.getPermittedCallsInHalfOpen(), ignore, clock);
        listeners.forEach(cb::addListener);
        if (metrics != null) {
            metrics.bindBreaker(cb);
        }
        return cb;
    }

    private GuardProperties.CbConfig configFor(String dependency) {
        Map<String, GuardProperties.CbConfig> per = props.getCbPerDependency();
        if (per != null && per.get(dependency) != null) {
            return per.get(dependency);
        }
        return props.getCircuitBreaker();
    }

    @Override
    public void afterPropertiesSet() {
        // 参数校验, 借构造器的检查让错误配置启动即失败
        new CircuitBreaker("validate", props.getCircuitBreaker().getFailureThreshold(),
                props.getCircuitBreaker().getRecoveryTimeout(),
                props.getCircuitBreaker().getPermittedCallsInHalfOpen(), null, clock);
        if (props.getCbPerDependency() != null) {
            props.getCbPerDependency().forEach((dep, c) -> new CircuitBreaker(dep, c.getFailureThreshold(),
                    c.getRecoveryTimeout(), c.getPermittedCallsInHalfOpen(), null, clock));
        }
    }
}
