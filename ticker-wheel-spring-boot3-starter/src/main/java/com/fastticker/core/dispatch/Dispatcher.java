package com.fastticker.core.dispatch;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.cluster.ClusterCoordinator;
import com.fastticker.core.cron.CronEngine;
import com.fastticker.core.execution.ExecutionEngine;
import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.notify.NotifyContexts;
import com.fastticker.core.notify.NotifyingFacade;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.exception.TickerValidationException;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.CronTickerEntity;
import com.fastticker.model.enums.Severity;
import com.fastticker.model.enums.TickerPriority;
import com.fastticker.model.enums.TickerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 调度周期: 物化 cron → 取到期行 → 按优先级排序 → 抢占 → 交给执行线程
 * 普通任务受 maxConcurrency 限制, LONG_RUNNING 走独立线程池且不占名额
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    /** HIGH → NORMAL → LOW, 同优先级按到期时间先后, 再按 id */
    static final Comparator<BaseTickerEntity> DISPATCH_ORDER = Comparator
            .comparingInt((BaseTickerEntity t) -> t.priorityOrDefault().getRank())
            .thenComparing(BaseTickerEntity::dueAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(BaseTickerEntity::getId);

    private final String nodeId;

    private final TickerStore store;

    private final CronEngine cronEngine;

    private final ExecutionEngine execution;

    /** 为 null 表示未启用集群协调 */
    private final ClusterCoordinator coordinator;

    /** 受限执行线程池 */
    private final ExecutorService workers;

    /** LONG_RUNNING 专用, 不限并发 */
    private final ExecutorService longRunning;

    private final Semaphore slots;

    private final int maxConcurrency;

    private final TickerWheelProperties props;

    private final TickerMetrics metrics;

    private final NotifyingFacade notifyService;

    private final Clock clock;

    private final AtomicBoolean inCycle = new AtomicBoolean(false);

    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public Dispatcher(String nodeId, TickerStore store, CronEngine cronEngine, ExecutionEngine execution,
                      ClusterCoordinator coordinator, ExecutorService workers, ExecutorService longRunning,
                      TickerWheelProperties props, TickerMetrics metrics, NotifyingFacade notifyService, Clock clock) {
        this.nodeId = nodeId;
        this.store = store;
        this.cronEngine = cronEngine;
        this.execution = execution;
        this.coordinator = coordinator;
        this.workers = workers;
        this.longRunning = longRunning;
        this.maxConcurrency = Math.max(1, props.getExecutor().getMaxConcurrency());
        this.slots = new Semaphore(maxConcurrency);
        this.props = props;
        this.metrics = metrics;
        this.notifyService = notifyService;
        this.clock = clock;
    }

    /**
     * 执行一个调度周期
     * 存储异常中断本周期, 已抢占的行照常执行, 下个周期重试
     *
     * @return 本周期交给执行线程的任务数
     */
    public int runCycle() {
        if (stopping.get()) {
            return 0;
        }
        if (!inCycle.compareAndSet(false, true)) {
            log.debug("[Dispatcher] previous cycle still running, skip");
            return 0;
        }
        try {
            if (coordinator != null && !coordinator.isSelfAlive()) {
                log.warn("[Dispatcher] heartbeat of node={} is stale, claiming suspended", nodeId);
                return 0;
            }
            Instant now = clock.instant();
            materializeCron(now);
            return dispatchDue(now);
        } catch (RuntimeException e) {
            log.error("[Dispatcher] cycle aborted, node={}", nodeId, e);
            metrics.incScanErr();
            notifyService.fire(NotifyContexts.ctxForEngineError(nodeId, "dispatch-cycle", e, clock), Severity.ERROR);
            return 0;
        } finally {
            inCycle.set(false);
        }
    }

    /**
     * 把 (nextOccurrence - ε, now] 内的 cron 边界物化为 occurrence, 再推进 nextOccurrence
     * 早于 now - catchUpWindow 的边界被丢弃
     */
    void materializeCron(Instant now) {
        int maxCatchUp = props.getCron().getMaxCatchUp();
        Instant catchUpFrom = now.minus(props.getCron().getCatchUpWindow());
        for (CronTickerEntity cron : store.findDueCronTickers(now, props.getScan().getBatch())) {
            Instant expected = cron.getNextOccurrence();
            List<Instant> boundaries;
            Instant next;
            try {
                Instant after = expected.minusMillis(1);
                if (after.isBefore(catchUpFrom)) {
                    after = catchUpFrom;
                }
                boundaries = cronEngine.boundaries(cron.getExpression(), after, now, maxCatchUp);
                next = cronEngine.nextOccurrence(cron.getExpression(), now);
            } catch (TickerValidationException e) {
                log.error("[Dispatcher] cron ticker={} has unusable expression '{}', skipped",
                        cron.getId(), cron.getExpression(), e);
                continue;
            }
            for (Instant boundary : boundaries) {
                store.upsertOccurrence(cron, boundary);
            }
            if (store.advanceCronTicker(cron.getId(), expected, next)) {
                log.debug("[Dispatcher] cron ticker={} materialized {} occurrence(s), next={}",
                        cron.getId(), boundaries.size(), next);
            }
        }
    }

    private int dispatchDue(Instant now) {
        int batch = props.getScan().getBatch();
        List<BaseTickerEntity> due = new ArrayList<>(store.findDue(TickerType.TIME, now, batch));
        due.addAll(store.findDue(TickerType.CRON_OCCURRENCE, now, batch));
        if (due.isEmpty()) {
            return 0;
        }
        due.sort(DISPATCH_ORDER);

        int dispatched = 0;
        for (BaseTickerEntity ticker : due) {
            if (stopping.get()) {
                break;
            }
            boolean bounded = ticker.priorityOrDefault() != TickerPriority.LONG_RUNNING;
            // 名额不足的普通任务留到下个周期, LONG_RUNNING 不受影响
            if (bounded && !slots.tryAcquire()) {
                continue;
            }
            boolean claimed;
            try {
                claimed = store.tryClaim(ticker.type(), ticker.getId(), nodeId, now);
            } catch (RuntimeException e) {
                if (bounded) slots.release();
                throw e;
            }
            if (!claimed) {
                if (bounded) slots.release();
                metrics.incClaimConflict();
                log.debug("[Dispatcher] ticker={} claimed by another node, skip", ticker.getId());
                continue;
            }
            ticker.setLockedBy(nodeId);
            ticker.setLockedAt(now);
            if (submit(ticker, bounded)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    private boolean submit(BaseTickerEntity ticker, boolean bounded) {
        try {
            (bounded ? workers : longRunning).execute(new DispatchTask(ticker, bounded));
            return true;
        } catch (RejectedExecutionException e) {
            if (bounded) slots.release();
            store.release(ticker.type(), ticker.getId(), nodeId);
            log.warn("[Dispatcher] ticker={} rejected by executor, claim released", ticker.getId());
            return false;
        }
    }

    /**
     * 停止派发, 未开始执行的任务释放抢占, 等待在途任务结束
     *
     * @return 是否在等待时长内全部结束
     */
    public boolean shutdown(Duration await) {
        stopping.set(true);
        workers.shutdown();
        longRunning.shutdown();
        long deadline = System.nanoTime() + Math.max(1, await.toNanos());
        try {
            boolean done = workers.awaitTermination(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)
                    && longRunning.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            if (!done) {
                log.warn("[Dispatcher] in-flight tickers still running after {}, interrupting", await);
                workers.shutdownNow();
                longRunning.shutdownNow();
            }
            return done;
        } catch (InterruptedException ie) {
            workers.shutdownNow();
            longRunning.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** 当前占用的名额 */
    public int inFlight() {
        return maxConcurrency - slots.availablePermits();
    }

    public boolean isStopping() {
        return stopping.get();
    }

    /**
     * 已抢占待执行的任务
     */
    private class DispatchTask implements Runnable {

        private final BaseTickerEntity ticker;

        private final boolean bounded;

        DispatchTask(BaseTickerEntity ticker, boolean bounded) {
            this.ticker = ticker;
            this.bounded = bounded;
        }

        @Override
        public void run() {
            try {
                if (stopping.get()) {
                    // 停机期间尚未开始的任务退回队列, 由其他节点或重启后执行
                    store.release(ticker.type(), ticker.getId(), nodeId);
                    log.info("[Dispatcher] ticker={} released on shutdown", ticker.getId());
                    return;
                }
                execution.execute(ticker);
            } catch (RuntimeException e) {
                log.error("[Dispatcher] ticker={} function={} execution error", ticker.getId(), ticker.getFunction(), e);
                releaseAfterFailure();
            } finally {
                if (bounded) {
                    slots.release();
                }
            }
        }

        /**
         * 结果写回失败时行仍由本节点持有, 退回队列由后续周期重新执行
         */
        private void releaseAfterFailure() {
            try {
                if (store.release(ticker.type(), ticker.getId(), nodeId)) {
                    log.warn("[Dispatcher] ticker={} released after failed write-back", ticker.getId());
                }
            } catch (RuntimeException e) {
                log.error("[Dispatcher] ticker={} could not be released, stays locked by node={}",
                        ticker.getId(), nodeId, e);
            }
        }
    }
}
