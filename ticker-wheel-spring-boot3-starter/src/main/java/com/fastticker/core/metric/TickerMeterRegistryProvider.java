package com.fastticker.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 引擎自己的注册表: 保底 Simple, 并合入业务方已有的注册表
 */
public class TickerMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public TickerMeterRegistryProvider(List<MeterRegistry> discovered) {
        this.composite = new CompositeMeterRegistry();
        this.composite.add(new SimpleMeterRegistry());

        if (discovered != null && !discovered.isEmpty()) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry c) {
                    c.getRegistries().forEach(this.composite::add);
                } else {
                    this.composite.add(mr);
                }
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
