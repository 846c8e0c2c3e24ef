package com.fastticker.core.backoff;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.spi.BackoffPolicy;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Instant next(Instant now, int attempt, TickerWheelProperties props) {
        long delay = props.backoffBaseMillis();
        double jr = props.getBackoff().getJitterRatio();
        if (jr > 0) {
            delay += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * delay);
        }
        delay = Math.max(props.backoffMinMillis(), Math.min(delay, props.backoffMaxMillis()));
        return now.plusMillis(Math.max(0, delay));
    }
}
