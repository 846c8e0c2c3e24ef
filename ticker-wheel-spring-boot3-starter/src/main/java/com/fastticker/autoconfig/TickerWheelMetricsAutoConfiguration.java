package com.fastticker.autoconfig;

import com.fastticker.core.metric.TickerMeterRegistryProvider;
import com.fastticker.core.metric.TickerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
public class TickerWheelMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TickerMeterRegistryProvider tickerMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new TickerMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TickerMetrics tickerMetrics(TickerMeterRegistryProvider provider) {
        return TickerMetrics.create(provider.getRegistry());
    }
}
