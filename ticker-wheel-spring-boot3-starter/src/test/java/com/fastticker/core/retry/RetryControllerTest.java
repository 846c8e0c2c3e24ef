package com.fastticker.core.retry;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.exception.TickerNonRetryableException;
import com.fastticker.model.ctx.TickerFunctionContext;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.IntervalOverflowPolicy;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.model.enums.TickerType;
import com.fastticker.support.MutableClock;
import com.fastticker.support.RecordingFunction;
import com.fastticker.support.TickerHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RetryControllerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private TickerHarness h;

    @AfterEach
    void tearDown() {
        if (h != null) {
            h.shutdown();
        }
    }

    @Test
    @DisplayName("Should retry three times with 60s then 300s reused, then fail")
    void testReuseLastInterval() {
        // Given
        h = TickerHarness.single(clock, TickerHarness.defaultProps(), RecordingFunction.named("report"));
        insert(3, List.of(60, 300));
        RuntimeException boom = new IllegalStateException("boom");

        // When / Then
        assertThat(failOnce(boom)).isEqualTo(TickerStatus.QUEUED);
        assertThat(row().getNextDueAt()).isEqualTo(T0.plusSeconds(60));

        clock.set(row().getNextDueAt());
        assertThat(failOnce(boom)).isEqualTo(TickerStatus.QUEUED);
        assertThat(row().getNextDueAt()).isEqualTo(T0.plusSeconds(60 + 300));

        clock.set(row().getNextDueAt());
        assertThat(failOnce(boom)).isEqualTo(TickerStatus.QUEUED);
        assertThat(row().getNextDueAt()).isEqualTo(T0.plusSeconds(60 + 300 + 300));
        assertThat(row().getRetryCount()).isEqualTo(3);
        // 计划时间不随重试改变
        assertThat(row().getExecutionTime()).isEqualTo(T0);

        clock.set(row().getNextDueAt());
        assertThat(failOnce(boom)).isEqualTo(TickerStatus.FAILED);
        TimeTickerEntity last = row();
        assertThat(last.getStatus()).isEqualTo(TickerStatus.FAILED);
        assertThat(last.getRetryCount()).isEqualTo(3);
        assertThat(last.getExceptionMessage()).contains("boom");
    }

    @Test
    @DisplayName("Should fall back to the backoff strategy past the last interval when configured")
    void testBackoffOverflow() {
        TickerWheelProperties props = TickerHarness.defaultProps();
        props.getRetry().setIntervalOverflow(IntervalOverflowPolicy.BACKOFF_STRATEGY);
        props.getBackoff().setStrategy("fixed");
        props.getBackoff().setBase(Duration.ofSeconds(7));
        h = TickerHarness.single(clock, props, RecordingFunction.named("report"));
        TimeTickerEntity t = insert(5, List.of(60, 300));

        assertThat(h.retry.nextDue(t, 0, T0)).isEqualTo(T0.plusSeconds(60));
        assertThat(h.retry.nextDue(t, 1, T0)).isEqualTo(T0.plusSeconds(300));
        assertThat(h.retry.nextDue(t, 2, T0)).isEqualTo(T0.plusSeconds(7));
    }

    @Test
    @DisplayName("Should use the backoff strategy when no intervals are given")
    void testNoIntervals() {
        TickerWheelProperties props = TickerHarness.defaultProps();
        props.getBackoff().setStrategy("fixed");
        props.getBackoff().setBase(Duration.ofSeconds(2));
        h = TickerHarness.single(clock, props, RecordingFunction.named("report"));
        TimeTickerEntity t = insert(1, null);

        assertThat(h.retry.nextDue(t, 0, T0)).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    @DisplayName("Should fail immediately on a non-retryable error")
    void testNonRetryable() {
        h = TickerHarness.single(clock, TickerHarness.defaultProps(), RecordingFunction.named("report"));
        insert(5, List.of(1));

        TickerStatus status = failOnce(new RuntimeException("wrapped", new TickerNonRetryableException("bad input")));

        assertThat(status).isEqualTo(TickerStatus.FAILED);
        assertThat(row().getRetryCount()).isZero();
    }

    @Test
    @DisplayName("Should fail on the first error when retries is zero")
    void testZeroRetries() {
        h = TickerHarness.single(clock, TickerHarness.defaultProps(), RecordingFunction.named("report"));
        insert(0, List.of(1));

        assertThat(failOnce(new IllegalStateException("x"))).isEqualTo(TickerStatus.FAILED);
    }

    private TimeTickerEntity insert(int retries, List<Integer> intervals) {
        TimeTickerEntity t = new TimeTickerEntity();
        t.setId("t-1");
        t.setFunction("report");
        t.setStatus(TickerStatus.IDLE);
        t.setRetries(retries);
        t.setRetryCount(0);
        t.setRetryIntervals(intervals);
        t.setExecutionTime(T0);
        h.store.addTimeTickers(List.of(t));
        return t;
    }

    private TickerStatus failOnce(Throwable error) {
        assertThat(h.store.tryClaim(TickerType.TIME, "t-1", h.nodeId, clock.instant())).isTrue();
        TimeTickerEntity claimed = row();
        TickerFunctionContext ctx = TickerFunctionContext.builder()
                .id(claimed.getId())
                .type(TickerType.TIME)
                .function(claimed.getFunction())
                .retryCount(claimed.retryCountOrZero())
                .retries(claimed.retriesOrZero())
                .build();
        return h.retry.onFailure(claimed, error, ctx, clock.instant());
    }

    private TimeTickerEntity row() {
        return h.store.getTimeTicker("t-1");
    }
}
