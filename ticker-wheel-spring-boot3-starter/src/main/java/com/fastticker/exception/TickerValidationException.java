package com.fastticker.exception;

/**
 * 创建/更新时的校验失败, 任务不会进入调度流程
 */
public class TickerValidationException extends RuntimeException {

    public TickerValidationException(String message) {
        super(message);
    }

    public TickerValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
