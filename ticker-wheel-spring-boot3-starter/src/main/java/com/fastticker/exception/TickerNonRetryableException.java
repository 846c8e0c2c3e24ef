package com.fastticker.exception;

/**
 * handler 抛出此异常时直接 FAILED, 跳过重试
 */
public class TickerNonRetryableException extends RuntimeException {

    public TickerNonRetryableException(String message) {
        super(message);
    }

    public TickerNonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
