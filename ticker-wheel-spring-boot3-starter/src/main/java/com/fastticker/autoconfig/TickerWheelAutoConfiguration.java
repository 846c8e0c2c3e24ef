package com.fastticker.autoconfig;

import com.fastticker.annotation.EnableTickerWheel;
import com.fastticker.config.TickerNotifierProperties;
import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.TickerEngine;
import com.fastticker.core.TickerEngineLifecycle;
import com.fastticker.core.backoff.BackoffRegistry;
import com.fastticker.core.chain.ChainEngine;
import com.fastticker.core.cluster.ClusterCoordinator;
import com.fastticker.core.cron.CronEngine;
import com.fastticker.core.dispatch.Dispatcher;
import com.fastticker.core.execution.CancellationRegistry;
import com.fastticker.core.execution.ExecutionEngine;
import com.fastticker.core.function.GuardedFunctionInvoker;
import com.fastticker.core.function.TickerFunctionRegistry;
import com.fastticker.core.manager.CronTickerManager;
import com.fastticker.core.manager.TimeTickerManager;
import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.notify.NotifyingFacade;
import com.fastticker.core.retry.DefaultFailureDecider;
import com.fastticker.core.retry.RetryController;
import com.fastticker.core.serializer.JacksonPayloadSerializer;
import com.fastticker.core.spi.BackoffPolicy;
import com.fastticker.core.spi.ClusterStore;
import com.fastticker.core.spi.FailureDecider;
import com.fastticker.core.spi.PayloadSerializer;
import com.fastticker.core.spi.TickerFunctionHandler;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.store.memory.InMemoryClusterStore;
import com.fastticker.store.memory.InMemoryTickerStore;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 时间轮、线程池及调度/执行组件
 */
@AutoConfiguration(after = {
        TickerWheelMybatisAutoConfiguration.class,
        TickerWheelMetricsAutoConfiguration.class,
        TickerNotifierAutoConfiguration.class,
        TickerGuardAutoConfiguration.class
})
@EnableConfigurationProperties({
        TickerWheelProperties.class,
        TickerNotifierProperties.class
})
public class TickerWheelAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TickerWheelAutoConfiguration.class);

    /**
     * 时间轮
     */
    @Bean(destroyMethod = "stop")
    public HashedWheelTimer tickerWheelTimer(TickerWheelProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("ticker-wheel-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 普通任务执行线程池, 在途数量由 Dispatcher 的名额控制
     */
    @Bean("tickerWorkerExecutor")
    public ExecutorService tickerWorkerExecutor(TickerWheelProperties props) {
        TickerWheelProperties.Exec exec = props.getExecutor();
        int size = Math.max(1, exec.getMaxConcurrency());
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                size,
                size,
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("ticker-worker-exec")
        );
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    /**
     * LONG_RUNNING 任务专用线程池
     */
    @Bean("tickerLongRunningExecutor")
    public ExecutorService tickerLongRunningExecutor() {
        return Executors.newCachedThreadPool(new NamedThreadFactory("ticker-long-running-exec"));
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock tickerClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronEngine cronEngine(TickerWheelProperties props) {
        return new CronEngine(props.cronZone());
    }

    /**
     * 未配置数据源时使用内存存储（单进程）
     */
    @Bean
    @ConditionalOnMissingBean(TickerStore.class)
    public TickerStore inMemoryTickerStore(Clock clock) {
        log.info("[Store] no mybatis store configured, falling back to in-memory store");
        return new InMemoryTickerStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean(ClusterStore.class)
    public ClusterStore inMemoryClusterStore() {
        return new InMemoryClusterStore();
    }

    /**
     * 策略注册中心
     */
    @Bean
    public BackoffRegistry backoffRegistry(TickerWheelProperties props,
                                           @Autowired(required = false) List<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies);
    }

    /**
     * 默认序列化
     */
    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 默认失败异常判断
     */
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider() {
        return new DefaultFailureDecider();
    }

    @Bean
    public TickerFunctionRegistry tickerFunctionRegistry(ObjectProvider<TickerFunctionHandler<?>> handlers) {
        return new TickerFunctionRegistry(handlers.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public CancellationRegistry cancellationRegistry() {
        return new CancellationRegistry();
    }

    @Bean
    public ChainEngine chainEngine(TickerStore store, Clock clock, TickerWheelProperties props) {
        return new ChainEngine(store, clock, props.getChain().getMaxDepth());
    }

    @Bean
    public RetryController retryController(TickerStore store, FailureDecider failureDecider,
                                           BackoffRegistry backoffRegistry, TickerMetrics metrics,
                                           NotifyingFacade notifyService, TickerWheelProperties props,
                                           Clock clock, Environment env) {
        return new RetryController(store, failureDecider, backoffRegistry, metrics, notifyService,
                props, clock, nodeId(props, env));
    }

    @Bean
    public ExecutionEngine executionEngine(TickerStore store, TickerFunctionRegistry functions,
                                           GuardedFunctionInvoker invoker, PayloadSerializer serializer,
                                           RetryController retryController, ChainEngine chain,
                                           CancellationRegistry cancellations, TickerMetrics metrics,
                                           NotifyingFacade notifyService, Clock clock,
                                           TickerWheelProperties props, Environment env) {
        return new ExecutionEngine(store, functions, invoker, serializer, retryController, chain,
                cancellations, metrics, notifyService, clock, nodeId(props, env));
    }

    /**
     * 心跳与宕机节点回收
     */
    @Bean
    @ConditionalOnProperty(prefix = "ticker.cluster", name = "enabled", matchIfMissing = true)
    public ClusterCoordinator clusterCoordinator(ClusterStore clusterStore, TickerStore store,
                                                 TickerMetrics metrics, NotifyingFacade notifyService,
                                                 Clock clock, TickerWheelProperties props, Environment env) {
        return new ClusterCoordinator(nodeId(props, env), clusterStore, store,
                props.getCluster().getNodeTtl(), metrics, notifyService, clock);
    }

    @Bean
    public Dispatcher dispatcher(TickerStore store, CronEngine cronEngine, ExecutionEngine execution,
                                 ObjectProvider<ClusterCoordinator> coordinator,
                                 @Qualifier("tickerWorkerExecutor") ExecutorService workers,
                                 @Qualifier("tickerLongRunningExecutor") ExecutorService longRunning,
                                 TickerMetrics metrics, NotifyingFacade notifyService, Clock clock,
                                 TickerWheelProperties props, Environment env) {
        return new Dispatcher(nodeId(props, env), store, cronEngine, execution, coordinator.getIfAvailable(),
                workers, longRunning, props, metrics, notifyService, clock);
    }

    @Bean
    public TimeTickerManager timeTickerManager(TickerStore store, TickerFunctionRegistry functions,
                                               ChainEngine chain, PayloadSerializer serializer,
                                               TickerMetrics metrics, TickerWheelProperties props, Clock clock) {
        return new TimeTickerManager(store, functions, chain, serializer, metrics, props, clock);
    }

    @Bean
    public CronTickerManager cronTickerManager(TickerStore store, TickerFunctionRegistry functions,
                                               CronEngine cronEngine, PayloadSerializer serializer,
                                               TickerWheelProperties props, Clock clock) {
        return new CronTickerManager(store, functions, cronEngine, serializer, props, clock);
    }

    /**
     * 调度引擎
     */
    @Bean
    public TickerEngine tickerEngine(HashedWheelTimer timer, Dispatcher dispatcher,
                                     ObjectProvider<ClusterCoordinator> coordinator,
                                     CancellationRegistry cancellations, TickerStore store,
                                     CronTickerManager cronManager, Clock clock,
                                     TickerWheelProperties props, Environment env) {
        return new TickerEngine(timer, dispatcher, coordinator.getIfAvailable(), cancellations, store,
                cronManager, props, clock, nodeId(props, env));
    }

    /**
     * 调度引擎启动器
     */
    @Bean
    public TickerEngineLifecycle tickerEngineLifecycle(TickerEngine engine,
                                                       TickerWheelProperties props,
                                                       TickerNotifierProperties notifyProps,
                                                       ApplicationContext applicationContext) {
        EnableTickerWheel enableTickerWheel = findEnableTickerWheel(applicationContext);
        if (enableTickerWheel != null) {
            TickerWheelProperties.Scan scan = props.getScan();
            scan.setEnabled(enableTickerWheel.value());
            props.setScan(scan);
        }
        return new TickerEngineLifecycle(engine, props, notifyProps);
    }

    /**
     * 节点标识: 配置优先, 否则 spring.application.name + uuid, 首次解析后回写配置保证各组件一致
     */
    static synchronized String nodeId(TickerWheelProperties props, Environment env) {
        String id = props.getNodeId();
        if (id == null || id.isBlank()) {
            String app = env.getProperty("spring.application.name", "ticker");
            id = app + "-" + UUID.randomUUID().toString().substring(0, 8);
            props.setNodeId(id);
        }
        return id;
    }

    private EnableTickerWheel findEnableTickerWheel(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n);
            if (type == null) continue;
            EnableTickerWheel an = type.getAnnotation(EnableTickerWheel.class);
            if (an != null) return an;
        }
        return null;
    }
}
