package com.fastticker.exception;

/**
 * 执行时找不到 function, 配置错误, 重试无意义
 */
public class FunctionNotFoundException extends RuntimeException {

    public FunctionNotFoundException(String function) {
        super("no ticker function registered under name '" + function + "'");
    }
}
