package com.fastticker.core.notify;

import com.fastticker.model.ctx.NotifyContext;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.CronTickerOccurrenceEntity;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class NotifyContexts {

    /** 错误文本落库/通知的最大长度 */
    public static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    public static NotifyContext ctxForFailed(String nodeId, BaseTickerEntity t, Throwable e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(t);
        attrs.put("status", "FAILED");
        attrs.put("nonRetryable", true);
        return of(NotifyEventType.FAILED, nodeId, t, "NON_RETRYABLE", errorText(e), clock, attrs);
    }

    public static NotifyContext ctxForMaxRetry(String nodeId, BaseTickerEntity t, Throwable e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(t);
        attrs.put("status", "FAILED");
        attrs.put("hit", "MAX_RETRY");
        return of(NotifyEventType.MAX_RETRY_REACHED, nodeId, t, "MAX_RETRY", errorText(e), clock, attrs);
    }

    public static NotifyContext ctxForFunctionNotFound(String nodeId, BaseTickerEntity t, Clock clock) {
        Map<String, Object> attrs = baseAttrs(t);
        attrs.put("status", "FAILED");
        return of(NotifyEventType.FUNCTION_NOT_FOUND, nodeId, t, "NO_FUNCTION",
                "no ticker function registered under name '" + t.getFunction() + "'", clock, attrs);
    }

    public static NotifyContext ctxForCancelled(String nodeId, BaseTickerEntity t, Clock clock) {
        Map<String, Object> attrs = baseAttrs(t);
        attrs.put("status", "CANCELLED");
        return of(NotifyEventType.CANCELLED, nodeId, t, "CANCELLED", null, clock, attrs);
    }

    public static NotifyContext ctxForReclaimed(String nodeId, String deadNodeId, int released, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("deadNode", deadNodeId);
        attrs.put("released", released);
        return new NotifyContext(NotifyEventType.RECLAIMED, nodeId, null, null, null,
                null, null, "NODE_DEAD", null, Instant.now(clock), attrs);
    }

    public static NotifyContext ctxForPersistFail(String nodeId, BaseTickerEntity t, String op, Exception e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(t);
        // setTerminal/reschedule/release/...
        attrs.put("op", op);
        return of(NotifyEventType.PERSIST_FAILED, nodeId, t, "PERSIST_FAILED", errorText(e), clock, attrs);
    }

    public static NotifyContext ctxForEngineError(String nodeId, String stage, Throwable e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("stage", stage);
        return new NotifyContext(NotifyEventType.ENGINE_ERROR, nodeId, null, null, null,
                null, null, "CYCLE_ABORTED", errorText(e), Instant.now(clock), attrs);
    }

    /**
     * 异常 → 截断后的文本, 附带前几行堆栈
     */
    public static String errorText(Throwable e) {
        if (e == null) return null;
        StringBuilder sb = new StringBuilder(e.getClass().getName())
                .append(": ").append(e.getMessage() == null ? "" : e.getMessage());
        StackTraceElement[] stack = e.getStackTrace();
        // 只取前10行，避免过长
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) sb.append("\n  at ").append(stack[i]);
        return truncate(sb.toString());
    }

    public static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }

    private static NotifyContext of(NotifyEventType type, String nodeId, BaseTickerEntity t, String reason,
                                     String error, Clock clock, Map<String, Object> attrs) {
        return new NotifyContext(type, nodeId, t.getFunction(), t.getId(), t.type(),
                t.retryCountOrZero(), t.retriesOrZero(), reason, error, Instant.now(clock), attrs);
    }

    private static Map<String, Object> baseAttrs(BaseTickerEntity t) {
        Map<String, Object> m = new HashMap<>();
        if (t.getLockedBy() != null) m.put("owner", t.getLockedBy());
        if (t.getExecutionTime() != null) m.put("executionTime", t.getExecutionTime().toString());
        if (t instanceof TimeTickerEntity tt && tt.getParentId() != null) {
            m.put("parentId", tt.getParentId());
        }
        if (t instanceof CronTickerOccurrenceEntity o) {
            m.put("cronTickerId", o.getCronTickerId());
        }
        return m;
    }
}
