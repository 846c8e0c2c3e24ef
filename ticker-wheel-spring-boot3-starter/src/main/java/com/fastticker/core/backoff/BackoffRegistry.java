package com.fastticker.core.backoff;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.spi.BackoffPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 退避策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "exponential";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final TickerWheelProperties props;

    public BackoffRegistry(TickerWheelProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> register(p.name(), p));
        }
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent(DEFAULT, new ExponentialJitterBackoffPolicy());
    }

    public BackoffRegistry(TickerWheelProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry register(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略, 找不到时回落到 exponential
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT));
    }

    /**
     * 按全局配置的策略计算下一次触发
     */
    public Instant next(Instant now, int attempt) {
        return resolve(props.getBackoff().getStrategy()).next(now, attempt, props);
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        long min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        if (max < min) {
            throw new IllegalArgumentException("ticker.backoff.max must be >= ticker.backoff.min");
        }
    }
}
