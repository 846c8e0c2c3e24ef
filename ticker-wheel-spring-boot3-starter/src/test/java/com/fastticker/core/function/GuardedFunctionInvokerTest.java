package com.fastticker.core.function;

import com.fastticker.config.TickerGuardProperties;
import com.fastticker.exception.guard.DownstreamOpenCircuitException;
import com.fastticker.exception.guard.DownstreamRateLimitedException;
import com.fastticker.model.ctx.TickerFunctionContext;
import com.fastticker.support.RecordingFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GuardedFunctionInvokerTest {

    @Test
    @DisplayName("Should call the function directly when no guard is enabled")
    void testDirect() throws Exception {
        RecordingFunction report = RecordingFunction.named("report");

        GuardedFunctionInvoker.direct().invoke(ctx("report"), "p", report);

        assertThat(report.payloads()).containsExactly("p");
        assertThat(GuardedFunctionInvoker.direct().getCircuitBreakerIfEnabled("report")).isNull();
    }

    @Test
    @DisplayName("Should reject calls beyond the per-function rate limit")
    void testRateLimited() throws Exception {
        TickerGuardProperties props = new TickerGuardProperties();
        TickerGuardProperties.RlConfig rl = new TickerGuardProperties.RlConfig();
        rl.setEnabled(true);
        rl.setLimitForPeriod(1);
        rl.setLimitRefreshPeriod(Duration.ofMinutes(1));
        rl.setTimeoutDuration(Duration.ZERO);
        props.setRlPerFunction(Map.of("report", rl));
        GuardedFunctionInvoker invoker = new GuardedFunctionInvoker(props);
        RecordingFunction report = RecordingFunction.named("report");
        RecordingFunction other = RecordingFunction.named("other");

        invoker.invoke(ctx("report"), null, report);

        assertThatThrownBy(() -> invoker.invoke(ctx("report"), null, report))
                .isInstanceOf(DownstreamRateLimitedException.class);
        assertThat(report.count()).isEqualTo(1);
        // 其他 function 不受影响
        invoker.invoke(ctx("other"), null, other);
        invoker.invoke(ctx("other"), null, other);
        assertThat(other.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should open the circuit after repeated failures")
    void testCircuitOpens() throws Exception {
        TickerGuardProperties props = new TickerGuardProperties();
        TickerGuardProperties.CbConfig cb = new TickerGuardProperties.CbConfig();
        cb.setEnabled(true);
        cb.setSlidingWindowSize(2);
        cb.setFailureRateThreshold(50f);
        cb.setWaitDurationInOpenState(Duration.ofMinutes(1));
        props.setCircuitBreaker(cb);
        GuardedFunctionInvoker invoker = new GuardedFunctionInvoker(props);
        RecordingFunction failing = RecordingFunction.named("failing")
                .body((c, p) -> { throw new IllegalStateException("down"); });

        assertThatThrownBy(() -> invoker.invoke(ctx("failing"), null, failing)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> invoker.invoke(ctx("failing"), null, failing)).isInstanceOf(IllegalStateException.class);

        assertThatThrownBy(() -> invoker.invoke(ctx("failing"), null, failing))
                .isInstanceOf(DownstreamOpenCircuitException.class);
        assertThat(failing.count()).isEqualTo(2);
        assertThat(invoker.getCircuitBreakerIfEnabled("failing")).isNotNull();
    }

    private static TickerFunctionContext ctx(String function) {
        return TickerFunctionContext.builder().id("t-1").function(function).build();
    }
}
