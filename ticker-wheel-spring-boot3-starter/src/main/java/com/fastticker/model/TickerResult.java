package com.fastticker.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 调度API返回结果
 * 可预期的失败（校验、找不到）通过结果返回, 不抛异常
 */
@Getter
@ToString
public final class TickerResult<T> {

    private final boolean succeeded;

    /** 单条操作的实体 */
    private final T result;

    /** 批量操作的实体 */
    private final List<T> results;

    /** 批量变更影响行数 */
    private final int affectedRows;

    private final Exception exception;

    private TickerResult(boolean succeeded, T result, List<T> results, int affectedRows, Exception exception) {
        this.succeeded = succeeded;
        this.result = result;
        this.results = results;
        this.affectedRows = affectedRows;
        this.exception = exception;
    }

    public static <T> TickerResult<T> ok(T result) {
        return new TickerResult<>(true, result, List.of(), result == null ? 0 : 1, null);
    }

    public static <T> TickerResult<T> ok(List<T> results, int affectedRows) {
        return new TickerResult<>(true, null, List.copyOf(results), affectedRows, null);
    }

    public static <T> TickerResult<T> affected(int affectedRows) {
        return new TickerResult<>(true, null, List.of(), affectedRows, null);
    }

    public static <T> TickerResult<T> failure(Exception e) {
        return new TickerResult<>(false, null, List.of(), 0, e);
    }

    /** 错误信息 */
    public String getError() {
        return exception == null ? null : exception.getMessage();
    }
}
