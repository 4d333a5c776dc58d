package com.fastguard.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * guard.* 指标的注册表: 保底一个 Simple, 并合入业务容器里已有的注册表
 */
public class GuardMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public GuardMeterRegistryProvider(List<MeterRegistry> discovered) {
        composite.add(new SimpleMeterRegistry());
        if (discovered == null) {
            return;
        }
        for (MeterRegistry mr : discovered) {
            if (mr instanceof CompositeMeterRegistry) {
                // 展开, 避免 composite 嵌套导致重复计数
                ((CompositeMeterRegistry) mr).getRegistries().forEach(composite::add);
            } else {
                composite.add(mr);
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
