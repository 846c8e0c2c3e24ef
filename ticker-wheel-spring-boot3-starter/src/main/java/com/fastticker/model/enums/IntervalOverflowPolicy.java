package com.fastticker.model.enums;

/**
 * 重试次数超过 retryIntervals 长度时的取值策略
 */
public enum IntervalOverflowPolicy {
    /** 复用最后一个间隔 */
    REUSE_LAST,

    /** 交给全局退避策略计算 */
    BACKOFF_STRATEGY
}
