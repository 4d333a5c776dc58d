package com.fastguard.autoconfig;

import com.fastguard.config.GuardDeadLetterProperties;
import com.fastguard.config.GuardNotifierProperties;
import com.fastguard.config.GuardProperties;
import com.fastguard.core.GuardLifecycle;
import com.fastguard.core.backoff.BackoffRegistry;
import com.fastguard.core.breaker.CircuitBreakerRegistry;
import com.fastguard.core.dlq.DeadLetterQueue;
import com.fastguard.core.guard.GuardedCallExecutor;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.core.notify.AdminNotifier;
import com.fastguard.core.notify.AsyncNotifyingService;
import com.fastguard.core.serializer.JacksonPayloadSerializer;
import com.fastguard.core.spi.BackoffPolicy;
import com.fastguard.core.spi.PayloadSerializer;
import com.fastguard.core.spi.failure.FailureDecider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * 熔断 / 退避 / 受保护调用入口
 */
@AutoConfiguration(after = {GuardMetricsAutoConfiguration.class, GuardFailureDeciderAutoConfiguration.class})
@ConditionalOnProperty(prefix = "guard", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties({
        GuardProperties.class,
        GuardDeadLetterProperties.class,
        GuardNotifierProperties.class
})
public class FastGuardAutoConfiguration {

    /** 熔断计时、死信时间戳、节流窗口共用的时钟 */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock guardClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(GuardProperties props,
                                           ObjectProvider<BackoffPolicy> policies,
                                           ObjectProvider<FailureDecider> failureDecider) {
        return new BackoffRegistry(props, policies.orderedStream().collect(Collectors.toList()),
                failureDecider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry(GuardProperties props, Clock clock, GuardMetrics metrics) {
        return new CircuitBreakerRegistry(props, clock, metrics);
    }

    /**
     * 受保护调用统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedCallExecutor guardedCallExecutor(CircuitBreakerRegistry breakers,
                                                   BackoffRegistry backoffs,
                                                   DeadLetterQueue dlq,
                                                   AdminNotifier notifier,
                                                   PayloadSerializer serializer,
                                                   GuardDeadLetterProperties dlqProps,
                                                   GuardNotifierProperties notifyProps,
                                                   GuardMetrics metrics,
                                                   Clock clock) {
        return new GuardedCallExecutor(breakers, backoffs, dlq, notifier, serializer,
                dlqProps, notifyProps, metrics, clock);
    }

    @Bean
    public GuardLifecycle guardLifecycle(GuardProperties props,
                                         GuardDeadLetterProperties dlqProps,
                                         GuardNotifierProperties notifyProps,
                                         DeadLetterQueue dlq,
                                         AsyncNotifyingService notifyingService) {
        return new GuardLifecycle(props, dlqProps, notifyProps, dlq, notifyingService);
    }
}
