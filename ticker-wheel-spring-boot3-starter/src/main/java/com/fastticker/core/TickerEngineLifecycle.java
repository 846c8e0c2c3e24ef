package com.fastticker.core;

import com.fastticker.config.TickerNotifierProperties;
import com.fastticker.config.TickerWheelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class TickerEngineLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TickerEngineLifecycle.class);

    private final TickerEngine engine;

    private final TickerWheelProperties props;

    private final TickerNotifierProperties notifyProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public TickerEngineLifecycle(TickerEngine engine, TickerWheelProperties props,
                                 TickerNotifierProperties notifyProps) {
        this.engine = engine;
        this.props = props;
        this.notifyProps = notifyProps;
    }

    @Override
    public void start() {
        if (!props.getScan().isEnabled()) {
            log.info("[Ticker-Engine] start skipped, scan disabled, nodeId={}", engine.getNodeId());
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ TickerEngine starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ nodeId               : {}", engine.getNodeId());
            log.info("│ scan.period          : {} ms", props.getScan().getPeriod().toMillis());
            log.info("│ scan.batch           : {}", props.getScan().getBatch());
            log.info("│ wheel.tick           : {} ms", props.getWheel().getTickDuration().toMillis());
            log.info("│ wheel.size           : {}", props.getWheel().getTicksPerWheel());
            log.info("│ executor.maxConc     : {}", props.getExecutor().getMaxConcurrency());
            log.info("│ retry.overflow       : {}", props.getRetry().getIntervalOverflow());
            log.info("│ backoff.strategy     : {}", props.getBackoff().getStrategy());
            log.info("│ cluster.enabled      : {}", props.getCluster().isEnabled());
            if (props.getCluster().isEnabled()) {
                log.info("│ cluster.heartbeat    : {} ms", props.getCluster().getHeartbeatInterval().toMillis());
                log.info("│ cluster.nodeTtl      : {} ms", props.getCluster().getNodeTtl().toMillis());
            }
            log.info("│ cron.zone            : {}", props.cronZone());
            log.info("│ notifier.enabled     : {}", notifyProps.isEnabled());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Ticker-Engine] failed to render startup banner: {}", t.toString());
        }
        engine.start();
        log.info("[Ticker-Engine] started: first scan in {} ms (nodeId={})",
                props.getScan().getInitialDelay().toMillis(), engine.getNodeId());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("[Ticker-Engine] stopping... (nodeId={})", engine.getNodeId());
        try {
            engine.gracefulShutdown(props.getShutdown().getAwait());
        } finally {
            log.info("[Ticker-Engine] stopped (nodeId={})", engine.getNodeId());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
