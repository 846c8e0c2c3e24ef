package com.fastticker.config;

import com.fastticker.model.enums.IntervalOverflowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 调度引擎配置（绑定前缀：ticker）
 *
 * YAML 示例：
 * ticker:
 *   node-id: order-service-1
 *   scan:
 *     enabled: true
 *     initial-delay: 200ms
 *     period: 1s
 *     batch: 200
 *   executor:
 *     max-concurrency: 8
 *     keep-alive: 60s
 *   wheel:
 *     tick-duration: 100ms
 *     ticks-per-wheel: 512
 *   retry:
 *     interval-overflow: REUSE_LAST
 *     default-retries: 0
 *   backoff:
 *     strategy: exponential
 *     base: 1s
 *     min: 500ms
 *     max: 300s
 *     jitter-ratio: 0.2
 *   cluster:
 *     enabled: true
 *     heartbeat-interval: 5s
 *     node-ttl: 30s
 *   cron:
 *     catch-up-window: 1m
 *     max-catch-up: 16
 *     zone: Asia/Shanghai
 *   chain:
 *     max-depth: 5
 *   shutdown:
 *     await: 30s
 */
@ConfigurationProperties(prefix = "ticker")
public class TickerWheelProperties {

    /** 节点标识, 为空时取 spring.application.name + uuid */
    private String nodeId;

    private Scan scan = new Scan();

    private Exec executor = new Exec();

    private Wheel wheel = new Wheel();

    private Retry retry = new Retry();

    private Backoff backoff = new Backoff();

    private Cluster cluster = new Cluster();

    private Cron cron = new Cron();

    private Chain chain = new Chain();

    private Shutdown shutdown = new Shutdown();

    private Tx tx = new Tx();

    // ----------------- 嵌套配置对象 -----------------

    public static class Scan {
        /** 是否启动扫描 */
        private boolean enabled = true;

        /** 首次扫描延迟 */
        private Duration initialDelay = Duration.ofMillis(200);

        /** 扫描周期 */
        private Duration period = Duration.ofSeconds(1);

        /** 每个种类每批最多取出的到期行 */
        private int batch = 200;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getPeriod() { return period; }
        public void setPeriod(Duration period) { this.period = period; }
        public int getBatch() { return batch; }
        public void setBatch(int batch) { this.batch = batch; }
    }

    public static class Exec {
        /** 同时在途的任务上限, LONG_RUNNING 不计入 */
        private int maxConcurrency = Runtime.getRuntime().availableProcessors();

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
    }

    public static class Wheel {
        /** 时间轮刻度（Duration 友好写法：100ms、1s） */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Retry {
        /** 重试次数超过间隔数组长度时的策略 */
        private IntervalOverflowPolicy intervalOverflow = IntervalOverflowPolicy.REUSE_LAST;

        /** 请求未指定 retries 时的默认值 */
        private int defaultRetries = 0;

        public IntervalOverflowPolicy getIntervalOverflow() { return intervalOverflow; }
        public void setIntervalOverflow(IntervalOverflowPolicy intervalOverflow) { this.intervalOverflow = intervalOverflow; }
        public int getDefaultRetries() { return defaultRetries; }
        public void setDefaultRetries(int defaultRetries) { this.defaultRetries = defaultRetries; }
    }

    public static class Backoff {
        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 基础间隔（指数退避的 base）：如 1s */
        private Duration base = Duration.ofSeconds(1);

        /** 最小间隔 */
        private Duration min = Duration.ofMillis(500);

        /** 最大间隔 */
        private Duration max = Duration.ofSeconds(300);

        /** 抖动比例（0~1），例如 0.2 表示 ±20% */
        private double jitterRatio = 0.2;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMin() { return min; }
        public void setMin(Duration min) { this.min = min; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    }

    public static class Cluster {
        /** 是否启用心跳与宕机回收 */
        private boolean enabled = true;

        /** 心跳周期 */
        private Duration heartbeatInterval = Duration.ofSeconds(5);

        /** 心跳超过该时长未更新即判定节点宕机 */
        private Duration nodeTtl = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public Duration getNodeTtl() { return nodeTtl; }
        public void setNodeTtl(Duration nodeTtl) { this.nodeTtl = nodeTtl; }
    }

    public static class Cron {
        /** 停机期间错过的边界最多向前追溯多久 */
        private Duration catchUpWindow = Duration.ofMinutes(1);

        /** 每个 cron 任务每周期最多物化的边界数 */
        private int maxCatchUp = 16;

        /** 计算边界使用的时区, 为空取系统时区 */
        private String zone;

        public Duration getCatchUpWindow() { return catchUpWindow; }
        public void setCatchUpWindow(Duration catchUpWindow) { this.catchUpWindow = catchUpWindow; }
        public int getMaxCatchUp() { return maxCatchUp; }
        public void setMaxCatchUp(int maxCatchUp) { this.maxCatchUp = maxCatchUp; }
        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }
    }

    public static class Chain {
        /** 父子链最大深度 */
        private int maxDepth = 5;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    public static class Tx {
        /** 默认传播行为 */
        private Propagation propagation = Propagation.REQUIRED;

        /** 只读事务（默认 false） */
        private boolean readOnly = false;

        /** 事务隔离级别（默认 DEFAULT） */
        private Isolation isolation = Isolation.DEFAULT;

        /** 超时（秒，<=0 表示不设置） */
        private int timeoutSeconds = 0;

        public Propagation getPropagation() { return propagation; }
        public void setPropagation(Propagation propagation) { this.propagation = propagation; }
        public boolean isReadOnly() { return readOnly; }
        public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }
        public Isolation getIsolation() { return isolation; }
        public void setIsolation(Isolation isolation) { this.isolation = isolation; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public Scan getScan() { return scan; }
    public void setScan(Scan scan) { this.scan = scan; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Cluster getCluster() { return cluster; }
    public void setCluster(Cluster cluster) { this.cluster = cluster; }

    public Cron getCron() { return cron; }
    public void setCron(Cron cron) { this.cron = cron; }

    public Chain getChain() { return chain; }
    public void setChain(Chain chain) { this.chain = chain; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public Tx getTx() { return tx; }
    public void setTx(Tx tx) { this.tx = tx; }

    // ----------------- 便捷换算 -----------------

    /** cron 计算时区 */
    public ZoneId cronZone() {
        return cron.getZone() == null || cron.getZone().isBlank()
                ? ZoneId.systemDefault() : ZoneId.of(cron.getZone());
    }

    /** 退避：基础/最小/最大毫秒 */
    public long backoffBaseMillis() { return backoff.getBase().toMillis(); }
    public long backoffMinMillis() { return backoff.getMin().toMillis(); }
    public long backoffMaxMillis() { return backoff.getMax().toMillis(); }
}
