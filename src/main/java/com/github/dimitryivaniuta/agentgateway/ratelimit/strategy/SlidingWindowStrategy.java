package com.github.dimitryivaniuta.agentgateway.ratelimit.strategy;

import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitConfig;
import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitResult;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding window log: keeps every accepted timestamp of the trailing window per key.
 *
 * <p>Entries at or before {@code now - window} are pruned on each check. Cost is linear in the
 * number of requests inside the window.
 */
public final class SlidingWindowStrategy extends AbstractStrategy<List<Double>> {

    private final Duration window;
    private final double windowSeconds;

    public SlidingWindowStrategy(Duration window, Clock clock, RateLimitStateStore.Settings settings) {
        super(clock, settings);
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
        this.windowSeconds = window.toNanos() / 1_000_000_000d;
    }

    public Duration window() {
        return window;
    }

    @Override
    public RateLimitResult check(String key, RateLimitConfig config) {
        final int limit = config.limitForWindow(window);
        final double now = nowSeconds();
        final double cutoff = now - windowSeconds;

        return store.update(key, current -> {
            List<Double> log = (current == null) ? new ArrayList<>() : current;
            log.removeIf(t -> t <= cutoff);
            int count = log.size();

            if (count < limit) {
                log.add(now);
                RateLimitResult allowed = RateLimitResult.allow(
                        limit - count - 1,
                        toInstant(now + windowSeconds),
                        limit
                );
                return new RateLimitStateStore.Update<>(log, allowed);
            }

            double oldest = log.isEmpty() ? now : min(log);
            double retryAfter = Math.max(0d, oldest + windowSeconds - now);
            RateLimitResult denied = RateLimitResult.deny(
                    toInstant(now + retryAfter),
                    seconds(retryAfter),
                    limit
            );
            return new RateLimitStateStore.Update<>(log, denied);
        });
    }

    private static double min(List<Double> values) {
        double m = Double.MAX_VALUE;
        for (double v : values) {
            if (v < m) m = v;
        }
        return m;
    }
}
