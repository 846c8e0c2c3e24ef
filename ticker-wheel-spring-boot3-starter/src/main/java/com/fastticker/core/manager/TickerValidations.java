package com.fastticker.core.manager;

import com.fastticker.core.function.TickerFunctionRegistry;
import com.fastticker.exception.TickerValidationException;

import java.util.List;

/**
 * 创建/更新请求的公共校验
 */
final class TickerValidations {

    private TickerValidations() {}

    static void requireFunction(TickerFunctionRegistry functions, String function) {
        if (function == null || function.isBlank()) {
            throw new TickerValidationException("function is required");
        }
        if (!functions.contains(function)) {
            throw new TickerValidationException("unknown function '" + function + "'");
        }
    }

    static int retries(Integer retries, int defaultRetries) {
        int r = retries == null ? defaultRetries : retries;
        if (r < 0) {
            throw new TickerValidationException("retries must be >= 0 but was " + r);
        }
        return r;
    }

    static List<Integer> intervals(List<Integer> intervals) {
        if (intervals == null) {
            return null;
        }
        for (Integer i : intervals) {
            if (i == null || i < 0) {
                throw new TickerValidationException("retry intervals must be non-negative seconds: " + intervals);
            }
        }
        return List.copyOf(intervals);
    }

    static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new TickerValidationException("id is required");
        }
        return id;
    }
}
