package com.fastticker.exception.guard;

/**
 * 熔断打开, 视为可重试的系统性故障
 */
public class DownstreamOpenCircuitException extends RuntimeException {

    public DownstreamOpenCircuitException(Throwable cause) {
        super("downstream circuit open", cause);
    }
}
