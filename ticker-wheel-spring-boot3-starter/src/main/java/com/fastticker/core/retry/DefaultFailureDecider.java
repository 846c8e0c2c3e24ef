package com.fastticker.core.retry;

import com.fastticker.core.spi.FailureDecider;
import com.fastticker.exception.TickerNonRetryableException;
import com.fastticker.model.ctx.TickerFunctionContext;

/**
 * 除 {@link TickerNonRetryableException} 外一律可重试
 */
public class DefaultFailureDecider implements FailureDecider {

    @Override
    public boolean isRetryable(Throwable t, TickerFunctionContext ctx) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof TickerNonRetryableException) {
                return false;
            }
            if (c.getCause() == c) {
                break;
            }
        }
        return true;
    }
}
