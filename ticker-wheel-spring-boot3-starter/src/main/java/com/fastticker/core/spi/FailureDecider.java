package com.fastticker.core.spi;

import com.fastticker.model.ctx.TickerFunctionContext;

/**
 * 失败判定器（可按异常类型决定是否可重试）
 */
public interface FailureDecider {

    /**
     * @return true=建议重试；false=直接 FAILED
     */
    boolean isRetryable(Throwable t, TickerFunctionContext ctx);
}
