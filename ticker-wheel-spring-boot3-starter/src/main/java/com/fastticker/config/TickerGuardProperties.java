package com.fastticker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * ticker:
 *   guard:
 *     circuit-breaker:
 *       enabled: true
 *       failure-rate-threshold: 60
 *       sliding-window-size: 200
 *       wait-duration-in-open-state: 15s
 *     bulkhead:
 *       enabled: true
 *       max-concurrent-calls: 20
 *     rate-limiter:
 *       enabled: true
 *       limit-for-period: 300
 *       limit-refresh-period: 100ms
 *     cb-per-function:
 *       sendInvoice: { enabled: true, failure-rate-threshold: 30, wait-duration-in-open-state: 5s }
 */
@Data
@ConfigurationProperties(prefix = "ticker.guard")
public class TickerGuardProperties {

    /** 默认配置（可被 function 覆盖）, 默认全部关闭 */
    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按 function 覆盖 */
    private Map<String, CbConfig> cbPerFunction;
    private Map<String, BhConfig> bhPerFunction;
    private Map<String, RlConfig> rlPerFunction;

    @Data
    public static class CbConfig {
        private boolean enabled = false;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(60);
        private int slidingWindowSize = 100;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
        private int permittedNumberOfCallsInHalfOpenState = 10;
    }

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 100;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 200;
        private Duration limitRefreshPeriod = Duration.ofMillis(100);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(20);
    }
}
