package com.fastticker.exception;

/**
 * handler 观察到取消信号后抛出, 任务进入 CANCELLED, 不重试
 */
public class TickerCancelledException extends RuntimeException {

    public TickerCancelledException(String tickerId) {
        super("ticker " + tickerId + " cancelled");
    }
}
