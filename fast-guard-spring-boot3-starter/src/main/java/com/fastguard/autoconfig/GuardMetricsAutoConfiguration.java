package com.fastguard.autoconfig;

import com.fastguard.core.metric.GuardMeterRegistryProvider;
import com.fastguard.core.metric.GuardMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration")
public class GuardMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GuardMeterRegistryProvider guardMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new GuardMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardMetrics guardMetrics(GuardMeterRegistryProvider provider) {
        return GuardMetrics.create(provider.getRegistry());
    }
}
