package com.fastticker.core.notify;

import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.notify.ratelimit.RateLimitFilter;
import com.fastticker.core.notify.route.SimpleRouter;
import com.fastticker.core.spi.notify.Notifier;
import com.fastticker.model.ctx.NotifyContext;
import com.fastticker.model.enums.NotifyEventType;
import com.fastticker.model.enums.Severity;
import com.fastticker.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class AsyncNotifyingServiceTest {

    private final ExecutorService exec = Executors.newSingleThreadExecutor();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));

    @AfterEach
    void tearDown() {
        exec.shutdownNow();
    }

    @Test
    @DisplayName("Should deliver events to every routed notifier")
    void testDelivery() {
        Recording a = new Recording("a", 0);
        Recording b = new Recording("b", 0);
        AsyncNotifyingService service = new AsyncNotifyingService(exec, new SimpleRouter(List.of(a, b)),
                null, TickerMetrics.noop());

        service.fire(event(NotifyEventType.MAX_RETRY_REACHED), Severity.WARNING);

        await().atMost(5, TimeUnit.SECONDS).until(() -> a.received.size() == 1 && b.received.size() == 1);
        assertThat(a.received.get(0).getTickerId()).isEqualTo("t-1");
    }

    @Test
    @DisplayName("Should retry a notifier that fails transiently")
    void testRetry() {
        Recording flaky = new Recording("flaky", 1);
        AsyncNotifyingService service = new AsyncNotifyingService(exec, new SimpleRouter(List.of(flaky)),
                null, TickerMetrics.noop());

        service.fire(event(NotifyEventType.FAILED), Severity.ERROR);

        await().atMost(5, TimeUnit.SECONDS).until(() -> flaky.received.size() == 1);
        assertThat(flaky.attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should suppress repeats of the same event beyond the threshold in one window")
    void testRateLimit() {
        RateLimitFilter filter = new RateLimitFilter(Duration.ofSeconds(30), 2, clock);

        assertThat(filter.allow(event(NotifyEventType.FAILED), Severity.ERROR)).isTrue();
        assertThat(filter.allow(event(NotifyEventType.FAILED), Severity.ERROR)).isTrue();
        assertThat(filter.allow(event(NotifyEventType.FAILED), Severity.ERROR)).isFalse();
        // 不同事件分别计数
        assertThat(filter.allow(event(NotifyEventType.CANCELLED), Severity.INFO)).isTrue();

        clock.advance(Duration.ofSeconds(31));
        assertThat(filter.allow(event(NotifyEventType.FAILED), Severity.ERROR)).isTrue();
    }

    @Test
    @DisplayName("Should truncate long error text")
    void testTruncate() {
        String longText = "x".repeat(NotifyContexts.MAX_ERROR_LEN + 100);

        assertThat(NotifyContexts.truncate(longText)).hasSizeLessThanOrEqualTo(NotifyContexts.MAX_ERROR_LEN);
        assertThat(NotifyContexts.errorText(new IllegalStateException("boom"))).contains("boom");
    }

    private static NotifyContext event(NotifyEventType type) {
        NotifyContext ctx = new NotifyContext();
        ctx.setType(type);
        ctx.setNodeId("node-1");
        ctx.setFunction("report");
        ctx.setTickerId("t-1");
        return ctx;
    }

    private static class Recording implements Notifier {

        private final String name;
        private final AtomicInteger failuresLeft;
        private final AtomicInteger attempts = new AtomicInteger();
        private final List<NotifyContext> received = new CopyOnWriteArrayList<>();

        Recording(String name, int failures) {
            this.name = name;
            this.failuresLeft = new AtomicInteger(failures);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void notify(NotifyContext ctx, Severity severity) {
            attempts.incrementAndGet();
            if (failuresLeft.getAndDecrement() > 0) {
                throw new IllegalStateException("webhook down");
            }
            received.add(ctx);
        }
    }
}
