package com.fastticker.autoconfig;

import com.fastticker.config.TickerNotifierProperties;
import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.notify.AsyncNotifyingService;
import com.fastticker.core.notify.NotifyingFacade;
import com.fastticker.core.notify.notifier.LoggingNotifier;
import com.fastticker.core.notify.ratelimit.RateLimitFilter;
import com.fastticker.core.notify.route.SimpleRouter;
import com.fastticker.core.spi.notify.Notifier;
import com.fastticker.core.spi.notify.NotifierRouter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@AutoConfiguration(after = TickerWheelMetricsAutoConfiguration.class)
@EnableConfigurationProperties(TickerNotifierProperties.class)
public class TickerNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    /** 广播给容器内全部 Notifier */
    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(ObjectProvider<Notifier> notifiers) {
        List<Notifier> all = notifiers.orderedStream().collect(Collectors.toList());
        return new SimpleRouter(all);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "ticker.notify", name = "enabled")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       TickerMetrics metrics,
                                                       TickerNotifierProperties props) {
        TickerNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "ticker-notify");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        RateLimitFilter filter = new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
        return new AsyncNotifyingService(exec, router, filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
