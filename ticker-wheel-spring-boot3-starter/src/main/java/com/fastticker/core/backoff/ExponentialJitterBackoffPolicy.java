package com.fastticker.core.backoff;

import com.fastticker.config.TickerWheelProperties;
import com.fastticker.core.spi.BackoffPolicy;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避 + 抖动: base * 2^attempt, 夹在 [min, max]
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Instant next(Instant now, int attempt, TickerWheelProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getBackoff().getJitterRatio();

        // attempt从0开始：0 -> base, 1 -> base * 2 ...
        double pow = Math.pow(2.0, Math.max(0, attempt));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);

        long jittered = ideal;
        if (jr > 0) {
            jittered += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * ideal);
        }
        long delay = Math.max(min, Math.min(jittered, max));
        return now.plusMillis(Math.max(0, delay));
    }
}
