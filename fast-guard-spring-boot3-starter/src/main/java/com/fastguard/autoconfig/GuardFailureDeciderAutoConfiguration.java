package com.fastguard.autoconfig;

import com.fastguard.core.failure.RouterFailureDecider;
import com.fastguard.core.failure.decider.IllegalArgumentHandler;
import com.fastguard.core.failure.decider.IoHandler;
import com.fastguard.core.failure.decider.NonRetryableHandler;
import com.fastguard.core.failure.decider.OpenCircuitHandler;
import com.fastguard.core.failure.decider.TimeoutHandler;
import com.fastguard.core.spi.failure.FailureCaseHandler;
import com.fastguard.core.spi.failure.FailureDecider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
public class GuardFailureDeciderAutoConfiguration {

    // 默认内置一组决策器（用户可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(OpenCircuitHandler.class)
    public OpenCircuitHandler openCircuitHandler(){ return new OpenCircuitHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler(){ return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(IoHandler.class)
    public IoHandler ioHandler(){ return new IoHandler(); }

    @Bean
    @ConditionalOnMissingBean(NonRetryableHandler.class)
    public NonRetryableHandler nonRetryableHandler(){ return new NonRetryableHandler(); }

    @Bean
    @ConditionalOnMissingBean(IllegalArgumentHandler.class)
    public IllegalArgumentHandler illegalArgumentHandler(){ return new IllegalArgumentHandler(); }

    // Router 决策器, 把所有 FailureCaseHandler 注入
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider(List<FailureCaseHandler<?>> handlers) {
        return new RouterFailureDecider(handlers);
    }
}
