package com.fastticker.core.notify;

import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.spi.notify.Notifier;
import com.fastticker.core.spi.notify.NotifierFilter;
import com.fastticker.core.spi.notify.NotifierRouter;
import com.fastticker.model.ctx.NotifyContext;
import com.fastticker.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步派发
 * 通过路由、限流、异步执行通知
 */
public class AsyncNotifyingService {

    private final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final NotifierFilter filter;

    private final TickerMetrics metrics;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter, TickerMetrics metrics) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.metrics = metrics;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            metrics.incNotifySuppressed();
            log.warn("[Notify] queue full, event={} ticker={} dropped", ctx.getType(), ctx.getTickerId());
        }
    }

    /** 容器关闭时丢弃排队中的通知 */
    public void shutdown() {
        exec.shutdownNow();
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        List<Notifier> notifiers = router.route(ctx, sev);
        for (Notifier n : notifiers) {
            if (!n.supports(ctx)) {
                continue;
            }
            try {
                int attempt = 0;
                long backoff = 200;
                while (true) {
                    try {
                        n.notify(ctx, sev);
                        break;
                    } catch (Exception e) {
                        if (++attempt >= 3) {
                            throw e;
                        }
                        Thread.sleep(backoff);
                        // 指数退避
                        backoff = Math.min(backoff * 2, 4000);
                    }
                }
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
            }
        }
    }
}
