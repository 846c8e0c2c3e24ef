package com.fastticker.core.function;

import com.fastticker.config.TickerGuardProperties;
import com.fastticker.core.spi.TickerFunctionHandler;
import com.fastticker.exception.guard.DownstreamBulkheadFullException;
import com.fastticker.exception.guard.DownstreamOpenCircuitException;
import com.fastticker.exception.guard.DownstreamRateLimitedException;
import com.fastticker.model.ctx.TickerFunctionContext;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * function 调用入口
 * 按 function 名称对 handler.execute 增加 RateLimiter/Bulkhead/CircuitBreaker 装饰, 全部关闭时直接调用
 */
public class GuardedFunctionInvoker {

    private final TickerGuardProperties props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bulkhead>      bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedFunctionInvoker(TickerGuardProperties props) {
        this.props = props;
    }

    /** 不做任何保护 */
    public static GuardedFunctionInvoker direct() {
        return new GuardedFunctionInvoker(new TickerGuardProperties());
    }

    public <T> void invoke(TickerFunctionContext ctx, T payload, TickerFunctionHandler<T> handler) throws Exception {
        String function = ctx.getFunction();
        Callable<Void> decorated = () -> {
            handler.execute(ctx, payload);
            return null;
        };

        // 组合装饰 RateLimiter → Bulkhead → CircuitBreaker
        if (enabled(props.getRateLimiter(), props.getRlPerFunction(), function, TickerGuardProperties.RlConfig::isEnabled)) {
            RateLimiter rl = rlCache.computeIfAbsent(function, this::buildRl);
            decorated = RateLimiter.decorateCallable(rl, decorated);
        }
        if (enabled(props.getBulkhead(), props.getBhPerFunction(), function, TickerGuardProperties.BhConfig::isEnabled)) {
            Bulkhead bh = bhCache.computeIfAbsent(function, this::buildBh);
            decorated = Bulkhead.decorateCallable(bh, decorated);
        }
        if (enabled(props.getCircuitBreaker(), props.getCbPerFunction(), function, TickerGuardProperties.CbConfig::isEnabled)) {
            CircuitBreaker cb = cbCache.computeIfAbsent(function, this::buildCb);
            decorated = CircuitBreaker.decorateCallable(cb, decorated);
        }

        try {
            decorated.call();
        } catch (CallNotPermittedException open) {
            throw new DownstreamOpenCircuitException(open);
        } catch (BulkheadFullException full) {
            throw new DownstreamBulkheadFullException(full);
        } catch (RequestNotPermitted rnp) {
            throw new DownstreamRateLimitedException(rnp);
        }
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String function) {
        if (!enabled(props.getCircuitBreaker(), props.getCbPerFunction(), function, TickerGuardProperties.CbConfig::isEnabled)) {
            return null;
        }
        return cbCache.computeIfAbsent(function, this::buildCb);
    }

    private RateLimiter buildRl(String function) {
        TickerGuardProperties.RlConfig r = pick(props.getRlPerFunction(), function, props.getRateLimiter());
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + function, cfg);
    }

    private Bulkhead buildBh(String function) {
        TickerGuardProperties.BhConfig b = pick(props.getBhPerFunction(), function, props.getBulkhead());
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + function, cfg);
    }

    private CircuitBreaker buildCb(String function) {
        TickerGuardProperties.CbConfig c = pick(props.getCbPerFunction(), function, props.getCircuitBreaker());
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                .build();
        return CircuitBreaker.of("cb:" + function, cfg);
    }

    private static <C> C pick(Map<String, C> perFunction, String function, C def) {
        C c = perFunction == null ? null : perFunction.get(function);
        return c == null ? def : c;
    }

    private static <C> boolean enabled(C defaultCfg, Map<String, C> perFunction, String function, Predicate<C> flag) {
        C c = pick(perFunction, function, defaultCfg);
        return c != null && flag.test(c);
    }
}
