package com.fastticker.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 终态写回时附带的执行记录
 */
@Value
@Builder
public class ExecutionRecord {

    Instant executedAt;

    Long elapsedMillis;

    String exceptionMessage;

    String skippedReason;

    public static ExecutionRecord empty() {
        return ExecutionRecord.builder().build();
    }
}
