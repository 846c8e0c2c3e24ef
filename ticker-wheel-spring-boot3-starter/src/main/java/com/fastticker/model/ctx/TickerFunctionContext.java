package com.fastticker.model.ctx;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fastticker.core.execution.CancellationToken;
import com.fastticker.core.spi.PayloadSerializer;
import com.fastticker.exception.TickerCancelledException;
import com.fastticker.model.enums.TickerType;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * handler 执行上下文
 */
@Getter
public class TickerFunctionContext {

    private final String id;
    private final TickerType type;
    private final String function;
    private final String nodeId;
    /** 仅 cron occurrence 有值 */
    private final String cronTickerId;
    /** 当前已重试次数 */
    private final int retryCount;
    private final int retries;
    /** 计划触发时间（不是实际开始时间） */
    private final Instant scheduledAt;

    private final byte[] rawRequest;
    private final PayloadSerializer serializer;
    private final CancellationToken cancellation;

    /** 懒加载的载荷 */
    private volatile Object request;
    private volatile boolean requestLoaded;

    @Builder
    public TickerFunctionContext(String id, TickerType type, String function, String nodeId, String cronTickerId,
                                 int retryCount, int retries, Instant scheduledAt,
                                 byte[] rawRequest, PayloadSerializer serializer, CancellationToken cancellation) {
        this.id = id;
        this.type = type;
        this.function = function;
        this.nodeId = nodeId;
        this.cronTickerId = cronTickerId;
        this.retryCount = retryCount;
        this.retries = retries;
        this.scheduledAt = scheduledAt;
        this.rawRequest = rawRequest;
        this.serializer = serializer;
        this.cancellation = cancellation == null ? new CancellationToken() : cancellation;
    }

    /**
     * 首次调用时反序列化, 之后返回同一个对象
     */
    @SuppressWarnings("unchecked")
    public <T> T getRequest(TypeReference<T> typeRef) {
        if (!requestLoaded) {
            synchronized (this) {
                if (!requestLoaded) {
                    request = (rawRequest == null || serializer == null)
                            ? null : serializer.deserialize(rawRequest, typeRef);
                    requestLoaded = true;
                }
            }
        }
        return (T) request;
    }

    public boolean isCancellationRequested() {
        return cancellation.poll();
    }

    public void throwIfCancellationRequested() {
        if (cancellation.poll()) {
            throw new TickerCancelledException(id);
        }
    }

    /** handler 自己也可以发起取消 */
    public void requestCancellation() {
        cancellation.request();
    }
}
