package com.fastticker.autoconfig;

import com.fastticker.config.TickerGuardProperties;
import com.fastticker.core.function.GuardedFunctionInvoker;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        TickerGuardProperties.class
})
public class TickerGuardAutoConfiguration {

    /**
     * 函数调用统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedFunctionInvoker guardedFunctionInvoker(TickerGuardProperties props) {
        return new GuardedFunctionInvoker(props);
    }
}
