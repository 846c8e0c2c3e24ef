package com.fastticker.core.spi;

import com.fastticker.config.TickerWheelProperties;

import java.time.Instant;

/**
 * 回退策略（计算下一次触发时间）
 * 任务未配置 retryIntervals, 或间隔用尽且策略为 BACKOFF_STRATEGY 时使用
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * @param now     当前时间
     * @param attempt 第几次重试, 从0开始
     * @param props   全局配置（读取 base/min/max/jitterRatio 等）
     */
    Instant next(Instant now, int attempt, TickerWheelProperties props);
}
