package com.github.dimitryivaniuta.agentgateway.ratelimit.strategy;

import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitConfig;
import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitResult;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed window counter aligned to multiples of the window size since the epoch.
 *
 * <p>Up to twice the limit can pass around a window boundary (end of one window plus
 * start of the next). Operators who do not want that on a tier should pick the sliding window.
 */
public final class FixedWindowStrategy extends AbstractStrategy<FixedWindowStrategy.Counter> {

    private final Duration window;
    private final double windowSeconds;

    public FixedWindowStrategy(Duration window, Clock clock, RateLimitStateStore.Settings settings) {
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
        final double windowStart = Math.floor(now / windowSeconds) * windowSeconds;
        final double windowEnd = windowStart + windowSeconds;

        return store.update(key, current -> {
            long count = (current == null || current.windowStart() != windowStart) ? 0L : current.count();

            if (count < limit) {
                RateLimitResult allowed = RateLimitResult.allow(
                        (int) (limit - count - 1),
                        toInstant(windowEnd),
                        limit
                );
                return new RateLimitStateStore.Update<>(new Counter(count + 1, windowStart), allowed);
            }

            RateLimitResult denied = RateLimitResult.deny(
                    toInstant(windowEnd),
                    seconds(windowEnd - now),
                    limit
            );
            return new RateLimitStateStore.Update<>(new Counter(count, windowStart), denied);
        });
    }

    record Counter(long count, double windowStart) {}
}
