package com.fastticker.core.retry;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.backoff.BackoffRegistry;
import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.notify.NotifyContexts;
import com.fastticker.core.notify.NotifyingFacade;
import com.fastticker.core.spi.FailureDecider;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.model.ExecutionRecord;
import com.fastticker.model.ctx.TickerFunctionContext;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.enums.IntervalOverflowPolicy;
import com.fastticker.model.enums.Severity;
import com.fastticker.model.enums.TickerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 失败处理: 按 retryIntervals 退避重排, 或置为 FAILED
 */
public class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final TickerStore store;

    private final FailureDecider failureDecider;

    private final BackoffRegistry backoff;

    private final TickerMetrics metrics;

    private final NotifyingFacade notifyService;

    private final TickerWheelProperties props;

    private final Clock clock;

    private final String nodeId;

    public RetryController(TickerStore store, FailureDecider failureDecider, BackoffRegistry backoff,
                           TickerMetrics metrics, NotifyingFacade notifyService,
                           TickerWheelProperties props, Clock clock, String nodeId) {
        this.store = store;
        this.failureDecider = failureDecider;
        this.backoff = backoff;
        this.metrics = metrics;
        this.notifyService = notifyService;
        this.props = props;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    /**
     * @param ticker    本节点已抢占的行
     * @param ex        handler 抛出的异常
     * @param startedAt 本次执行开始时间
     * @return QUEUED=已安排重试；FAILED=终态；IN_PROGRESS=本节点已失去抢占, 未写入
     */
    public TickerStatus onFailure(BaseTickerEntity ticker, Throwable ex, TickerFunctionContext ctx, Instant startedAt) {
        int attempt = ticker.retryCountOrZero();
        String err = NotifyContexts.errorText(ex);
        boolean retryable = failureDecider.isRetryable(ex, ctx);

        if (retryable && attempt < ticker.retriesOrZero()) {
            Instant now = clock.instant();
            Instant nextDue = nextDue(ticker, attempt, now);
            boolean ok;
            try {
                ok = store.reschedule(ticker.type(), ticker.getId(), nodeId, nextDue, TickerStatus.QUEUED, attempt + 1, err);
            } catch (RuntimeException e) {
                notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, ticker, "reschedule", e, clock), Severity.ERROR);
                throw e;
            }
            if (!ok) {
                log.warn("[Retry] ticker={} no longer owned by node={}, reschedule dropped", ticker.getId(), nodeId);
                return TickerStatus.IN_PROGRESS;
            }
            metrics.incRetried();
            log.info("[Retry] ticker={} function={} attempt={}/{} next={}",
                    ticker.getId(), ticker.getFunction(), attempt + 1, ticker.retriesOrZero(), nextDue);
            return TickerStatus.QUEUED;
        }

        ExecutionRecord record = ExecutionRecord.builder()
                .executedAt(startedAt)
                .elapsedMillis(clock.millis() - startedAt.toEpochMilli())
                .exceptionMessage(err)
                .build();
        boolean ok;
        try {
            ok = store.setTerminal(ticker.type(), ticker.getId(), nodeId, TickerStatus.FAILED, record);
        } catch (RuntimeException e) {
            notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, ticker, "setTerminal", e, clock), Severity.ERROR);
            throw e;
        }
        if (!ok) {
            log.warn("[Retry] ticker={} no longer owned by node={}, FAILED not written", ticker.getId(), nodeId);
            return TickerStatus.IN_PROGRESS;
        }
        metrics.incFailed();
        if (!retryable) {
            log.warn("[Retry] ticker={} function={} failed with non-retryable error: {}",
                    ticker.getId(), ticker.getFunction(), ex.toString());
            notifyService.fire(NotifyContexts.ctxForFailed(nodeId, ticker, ex, clock), Severity.WARNING);
        } else {
            log.warn("[Retry] ticker={} function={} exhausted {} retries: {}",
                    ticker.getId(), ticker.getFunction(), ticker.retriesOrZero(), ex.toString());
            notifyService.fire(NotifyContexts.ctxForMaxRetry(nodeId, ticker, ex, clock), Severity.WARNING);
        }
        return TickerStatus.FAILED;
    }

    /**
     * 第 attempt 次重试（从0开始）的到期时间
     * 下标越界时按 interval-overflow 策略处理
     */
    public Instant nextDue(BaseTickerEntity ticker, int attempt, Instant now) {
        List<Integer> intervals = ticker.getRetryIntervals();
        if (intervals == null || intervals.isEmpty()) {
            return backoff.next(now, attempt);
        }
        if (attempt >= intervals.size()
                && props.getRetry().getIntervalOverflow() == IntervalOverflowPolicy.BACKOFF_STRATEGY) {
            return backoff.next(now, attempt);
        }
        int seconds = intervals.get(Math.min(attempt, intervals.size() - 1));
        return now.plusSeconds(Math.max(0, seconds));
    }
}
