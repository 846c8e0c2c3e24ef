package com.fastticker.exception;

/**
 * 存储/协调层不可用
 * 扫描周期遇到后中断, 下个周期重试
 */
public class TickerStoreException extends RuntimeException {

    public TickerStoreException(String message) {
        super(message);
    }

    public TickerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
