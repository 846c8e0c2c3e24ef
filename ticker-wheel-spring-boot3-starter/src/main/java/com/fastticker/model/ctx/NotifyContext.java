package com.fastticker.model.ctx;

import com.fastticker.model.enums.NotifyEventType;
import com.fastticker.model.enums.TickerType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotifyContext {

    private NotifyEventType type;
    private String nodeId;
    private String function;
    private String tickerId;
    private TickerType tickerType;
    private Integer retryCount;
    private Integer retries;
    // 自定义分类码，如 MAX_RETRY/NO_FUNCTION/CYCLE_ABORTED
    private String reasonCode;
    // 可被截断
    private String lastError;
    // 事件发生时间
    private Instant when;
    // 额外字段：owner、executionTime、deadNode 等
    private Map<String, Object> attributes;
}
