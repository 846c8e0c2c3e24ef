package com.fastticker.core.execution;

import com.fastticker.core.chain.ChainEngine;
import com.fastticker.core.function.GuardedFunctionInvoker;
import com.fastticker.core.function.TickerFunctionRegistry;
import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.notify.NotifyContexts;
import com.fastticker.core.notify.NotifyingFacade;
import com.fastticker.core.retry.RetryController;
import com.fastticker.core.spi.PayloadSerializer;
import com.fastticker.core.spi.TickerFunctionHandler;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.exception.FunctionNotFoundException;
import com.fastticker.exception.TickerCancelledException;
import com.fastticker.exception.TickerNonRetryableException;
import com.fastticker.model.ExecutionRecord;
import com.fastticker.model.ctx.TickerFunctionContext;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.CronTickerOccurrenceEntity;
import com.fastticker.model.enums.Severity;
import com.fastticker.model.enums.TickerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 执行一个已被本节点抢占的任务, 并把结果映射为状态
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String SKIP_SUPERSEDED = "SUPERSEDED_BY_NEWER_OCCURRENCE";

    private final TickerStore store;

    private final TickerFunctionRegistry functions;

    private final GuardedFunctionInvoker invoker;

    private final PayloadSerializer serializer;

    private final RetryController retryController;

    private final ChainEngine chain;

    private final CancellationRegistry cancellations;

    private final TickerMetrics metrics;

    private final NotifyingFacade notifyService;

    private final Clock clock;

    private final String nodeId;

    public ExecutionEngine(TickerStore store, TickerFunctionRegistry functions, GuardedFunctionInvoker invoker,
                           PayloadSerializer serializer, RetryController retryController, ChainEngine chain,
                           CancellationRegistry cancellations, TickerMetrics metrics,
                           NotifyingFacade notifyService, Clock clock, String nodeId) {
        this.store = store;
        this.functions = functions;
        this.invoker = invoker;
        this.serializer = serializer;
        this.retryController = retryController;
        this.chain = chain;
        this.cancellations = cancellations;
        this.metrics = metrics;
        this.notifyService = notifyService;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    /**
     * @return 本次执行后的状态；QUEUED 表示已安排重试或延后；
     *         IN_PROGRESS 表示本节点已失去抢占, 结果未写入
     */
    public TickerStatus execute(BaseTickerEntity ticker) {
        Instant startedAt = clock.instant();
        if (ticker.dueAt() != null) {
            metrics.recordWaitMillis(startedAt.toEpochMilli() - ticker.dueAt().toEpochMilli());
        }

        Optional<TickerFunctionHandler<?>> handler = functions.find(ticker.getFunction());
        if (handler.isEmpty()) {
            return functionNotFound(ticker, startedAt);
        }

        if (ticker instanceof CronTickerOccurrenceEntity occurrence) {
            if (store.existsNewerDueOccurrence(occurrence.getCronTickerId(), occurrence.getExecutionTime(), startedAt)) {
                return skip(occurrence, startedAt);
            }
            if (store.existsRunningOccurrenceBefore(occurrence.getCronTickerId(), occurrence.getExecutionTime())) {
                // 上一次仍在执行, 不并发执行同一个 cron
                log.debug("[Execution] occurrence={} deferred, previous occurrence of cron={} still running",
                        occurrence.getId(), occurrence.getCronTickerId());
                store.release(ticker.type(), ticker.getId(), nodeId);
                return TickerStatus.QUEUED;
            }
        }

        chainSafely(() -> chain.onInProgress(ticker), ticker);

        CancellationToken token = cancellations.register(ticker.getId());
        TickerFunctionContext ctx = TickerFunctionContext.builder()
                .id(ticker.getId())
                .type(ticker.type())
                .function(ticker.getFunction())
                .nodeId(nodeId)
                .cronTickerId(ticker instanceof CronTickerOccurrenceEntity o ? o.getCronTickerId() : null)
                .retryCount(ticker.retryCountOrZero())
                .retries(ticker.retriesOrZero())
                .scheduledAt(ticker.getExecutionTime())
                .rawRequest(ticker.getRequestPayload())
                .serializer(serializer)
                .cancellation(token)
                .build();

        TickerStatus status;
        Exception failure = null;
        long t0 = System.nanoTime();
        try {
            invoke(handler.get(), ctx);
            if (token.isObserved()) {
                status = TickerStatus.CANCELLED;
            } else {
                // 开始时间不晚于计划时间点 → DUE_DONE
                status = ticker.getExecutionTime() == null || !startedAt.isAfter(ticker.getExecutionTime())
                        ? TickerStatus.DUE_DONE : TickerStatus.DONE;
            }
        } catch (TickerCancelledException e) {
            status = TickerStatus.CANCELLED;
        } catch (Exception ex) {
            status = token.isObserved() ? TickerStatus.CANCELLED : null;
            failure = ex;
        } finally {
            cancellations.unregister(ticker.getId(), token);
            metrics.recordExecNanos(System.nanoTime() - t0);
        }

        if (status == null) {
            log.debug("[Execution] ticker={} function={} threw {}", ticker.getId(), ticker.getFunction(), failure.toString());
            status = retryController.onFailure(ticker, failure, ctx, startedAt);
        } else {
            ExecutionRecord record = ExecutionRecord.builder()
                    .executedAt(startedAt)
                    .elapsedMillis(clock.millis() - startedAt.toEpochMilli())
                    .build();
            if (!writeTerminal(ticker, status, record)) {
                return TickerStatus.IN_PROGRESS;
            }
            if (status == TickerStatus.CANCELLED) {
                metrics.incCancelled();
                log.info("[Execution] ticker={} function={} cancelled", ticker.getId(), ticker.getFunction());
                notifyService.fire(NotifyContexts.ctxForCancelled(nodeId, ticker, clock), Severity.INFO);
            } else {
                metrics.incDone();
            }
        }

        if (status.isTerminal()) {
            TickerStatus terminal = status;
            chainSafely(() -> chain.onTerminal(ticker, terminal), ticker);
        }
        return status;
    }

    private <T> void invoke(TickerFunctionHandler<T> handler, TickerFunctionContext ctx) throws Exception {
        T payload;
        try {
            payload = ctx.getRequest(handler.payloadType());
        } catch (IllegalStateException e) {
            // 载荷与 handler 类型不匹配, 重试无意义
            throw new TickerNonRetryableException("payload of ticker " + ctx.getId() + " cannot be decoded", e);
        }
        invoker.invoke(ctx, payload, handler);
    }

    private TickerStatus functionNotFound(BaseTickerEntity ticker, Instant startedAt) {
        FunctionNotFoundException e = new FunctionNotFoundException(ticker.getFunction());
        ExecutionRecord record = ExecutionRecord.builder()
                .executedAt(startedAt)
                .elapsedMillis(0L)
                .exceptionMessage(e.getMessage())
                .build();
        if (!writeTerminal(ticker, TickerStatus.FAILED, record)) {
            return TickerStatus.IN_PROGRESS;
        }
        metrics.incFailed();
        log.error("[Execution] ticker={} failed: {}", ticker.getId(), e.getMessage());
        notifyService.fire(NotifyContexts.ctxForFunctionNotFound(nodeId, ticker, clock), Severity.ERROR);
        chainSafely(() -> chain.onTerminal(ticker, TickerStatus.FAILED), ticker);
        return TickerStatus.FAILED;
    }

    private TickerStatus skip(CronTickerOccurrenceEntity occurrence, Instant startedAt) {
        ExecutionRecord record = ExecutionRecord.builder()
                .executedAt(startedAt)
                .elapsedMillis(0L)
                .skippedReason(SKIP_SUPERSEDED)
                .build();
        if (!writeTerminal(occurrence, TickerStatus.SKIPPED, record)) {
            return TickerStatus.IN_PROGRESS;
        }
        metrics.incSkipped();
        log.info("[Execution] occurrence={} of cron={} at {} skipped: {}", occurrence.getId(),
                occurrence.getCronTickerId(), occurrence.getExecutionTime(), SKIP_SUPERSEDED);
        return TickerStatus.SKIPPED;
    }

    /**
     * @return false 表示行已被回收或由其他节点完成, 调用方不再触发指标、通知与子任务
     */
    private boolean writeTerminal(BaseTickerEntity ticker, TickerStatus status, ExecutionRecord record) {
        boolean ok;
        try {
            ok = store.setTerminal(ticker.type(), ticker.getId(), nodeId, status, record);
        } catch (RuntimeException e) {
            notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, ticker, "setTerminal", e, clock), Severity.ERROR);
            throw e;
        }
        if (!ok) {
            log.warn("[Execution] ticker={} no longer owned by node={}, {} not written", ticker.getId(), nodeId, status);
        }
        return ok;
    }

    /**
     * 放行子任务失败不影响父任务本身的结果
     */
    private void chainSafely(Runnable action, BaseTickerEntity ticker) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("[Execution] chain evaluation for ticker={} failed", ticker.getId(), e);
            notifyService.fire(NotifyContexts.ctxForEngineError(nodeId, "chain", e, clock), Severity.ERROR);
        }
    }
}
