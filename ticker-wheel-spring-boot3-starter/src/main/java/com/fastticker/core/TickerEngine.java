package com.fastticker.core;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.cluster.ClusterCoordinator;
import com.fastticker.core.dispatch.Dispatcher;
import com.fastticker.core.execution.CancellationRegistry;
import com.fastticker.core.manager.CronTickerManager;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.model.WheelTask;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.TickerStatus;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 调度引擎
 * 时间轮驱动两个周期: 调度周期与心跳周期, 每个周期结束后把下一轮挂回时间轮
 */
public class TickerEngine {

    private static final Logger log = LoggerFactory.getLogger(TickerEngine.class);

    /** 时间轮 */
    private final HashedWheelTimer timer;

    /** 扫描线程, 调度周期不在时间轮线程上执行 */
    private final ExecutorService scanExecutor;

    private final Dispatcher dispatcher;

    /** 为 null 表示未启用集群协调 */
    private final ClusterCoordinator coordinator;

    private final CancellationRegistry cancellations;

    private final TickerStore store;

    private final CronTickerManager cronManager;

    private final TickerWheelProperties props;

    private final Clock clock;

    private final String nodeId;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public TickerEngine(HashedWheelTimer timer, Dispatcher dispatcher, ClusterCoordinator coordinator,
                        CancellationRegistry cancellations, TickerStore store, CronTickerManager cronManager,
                        TickerWheelProperties props, Clock clock, String nodeId) {
        this.timer = timer;
        this.dispatcher = dispatcher;
        this.coordinator = coordinator;
        this.cancellations = cancellations;
        this.store = store;
        this.cronManager = cronManager;
        this.props = props;
        this.clock = clock;
        this.nodeId = nodeId;
        this.scanExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("ticker-scan"));
    }

    public String getNodeId() { return nodeId; }

    public boolean isRunning() { return running.get(); }

    /**
     * 首次心跳、cron 种子, 然后挂上两个周期
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        if (coordinator != null) {
            coordinator.heartbeat();
            scheduleHeartbeat(props.getCluster().getHeartbeatInterval().toMillis());
        }
        int seeded = cronManager.seedDeclared();
        if (seeded > 0) {
            log.info("[Ticker-Engine] seeded {} function-declared cron ticker(s)", seeded);
        }
        scheduleScan(props.getScan().getInitialDelay().toMillis());
    }

    protected void scheduleScan(long delayMs) {
        Runnable scan = () -> {
            if (!running.get()) {
                return;
            }
            try {
                scanExecutor.execute(() -> {
                    try {
                        dispatcher.runCycle();
                    } finally {
                        // 将下轮 scan 挂到时间轮
                        if (running.get()) {
                            scheduleScan(props.getScan().getPeriod().toMillis());
                        }
                    }
                });
            } catch (RejectedExecutionException e) {
                log.debug("[Ticker-Engine] scan executor closed, scan loop ends");
            }
        };
        submit(new WheelTask(WheelTask.Kind.SCAN, scan), delayMs);
    }

    protected void scheduleHeartbeat(long delayMs) {
        Runnable beat = () -> {
            if (!running.get()) {
                return;
            }
            try {
                coordinator.tick();
            } finally {
                if (running.get()) {
                    scheduleHeartbeat(props.getCluster().getHeartbeatInterval().toMillis());
                }
            }
        };
        submit(new WheelTask(WheelTask.Kind.HEARTBEAT, beat), delayMs);
    }

    private void submit(WheelTask task, long delayMs) {
        try {
            timer.newTimeout(task, delayMs, TimeUnit.MILLISECONDS);
        } catch (IllegalStateException e) {
            // 时间轮已停止
            log.debug("[Ticker-Engine] wheel stopped, {} loop ends", task.getKind());
        }
    }

    /**
     * 立即执行: 把未被抢占的根任务到期时间提前到现在, 并触发一次调度
     *
     * @return false=任务不存在、已被抢占/终结, 或是等待父任务的子任务
     */
    public boolean runNow(String timeTickerId) {
        TimeTickerEntity t = store.getTimeTicker(timeTickerId);
        if (t == null || !t.getStatus().isClaimable()) {
            return false;
        }
        if (t.getParentId() != null && t.getStatus() == TickerStatus.IDLE) {
            log.info("[Ticker-Engine] ticker={} is waiting for parent={}, run-now ignored", timeTickerId, t.getParentId());
            return false;
        }
        if (!store.expedite(timeTickerId, clock.instant())) {
            return false;
        }
        if (running.get()) {
            try {
                scanExecutor.execute(dispatcher::runCycle);
            } catch (RejectedExecutionException e) {
                log.debug("[Ticker-Engine] scan executor closed, ticker={} waits for next node", timeTickerId);
            }
        }
        return true;
    }

    /**
     * 向本节点正在执行的任务发出取消信号
     *
     * @return 任务是否正在本节点执行
     */
    public boolean requestCancellation(String tickerId) {
        boolean found = cancellations.request(tickerId);
        log.info("[Ticker-Engine] cancellation requested for ticker={}, running here={}", tickerId, found);
        return found;
    }

    /**
     * 停止扫描与时间轮, 未开始的任务释放抢占, 等待在途任务, 最后退出集群
     */
    public void gracefulShutdown(Duration await) {
        running.set(false);
        timer.stop();
        scanExecutor.shutdown();
        boolean drained = dispatcher.shutdown(await);
        try {
            scanExecutor.awaitTermination(Math.min(2000, Math.max(1, await.toMillis())), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        if (!drained) {
            // 被中断的 handler 仍持有抢占, 交还给其他节点
            int released = store.releaseAllLockedBy(nodeId);
            log.warn("[Ticker-Engine] released {} ticker(s) still held after {}", released, await);
        }
        if (coordinator != null) {
            coordinator.leave();
        }
        log.info("[Ticker-Engine] graceful shutdown done, node={}, drained={}", nodeId, drained);
    }
}
