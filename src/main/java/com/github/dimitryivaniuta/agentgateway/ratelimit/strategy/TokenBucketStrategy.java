package com.github.dimitryivaniuta.agentgateway.ratelimit.strategy;

import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitConfig;
import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitResult;

import java.time.Clock;

/**
 * Token bucket: capacity {@code burstSize}, refilled lazily at {@code requestsPerSecond}.
 *
 * <p>A key seen for the first time starts with a full bucket. A denied check consumes nothing
 * but still advances the refill timestamp.
 */
public final class TokenBucketStrategy extends AbstractStrategy<TokenBucketStrategy.Bucket> {

    public TokenBucketStrategy(Clock clock, RateLimitStateStore.Settings settings) {
        super(clock, settings);
    }

    @Override
    public RateLimitResult check(String key, RateLimitConfig config) {
        final double rate = config.requestsPerSecond();
        final int capacity = config.burstSize();
        final double now = nowSeconds();

        return store.update(key, current -> {
            double tokens = (current == null)
                    ? capacity
                    : refill(current, now, rate, capacity);

            if (tokens >= 1d) {
                double left = tokens - 1d;
                RateLimitResult allowed = RateLimitResult.allow(
                        (int) Math.floor(left),
                        toInstant(now + 1d / rate),
                        capacity
                );
                return new RateLimitStateStore.Update<>(new Bucket(left, now), allowed);
            }

            double untilToken = (1d - tokens) / rate;
            RateLimitResult denied = RateLimitResult.deny(
                    toInstant(now + untilToken),
                    seconds(untilToken),
                    capacity
            );
            return new RateLimitStateStore.Update<>(new Bucket(tokens, now), denied);
        });
    }

    /**
     * Current token count without consuming, for tests and diagnostics.
     */
    public double tokens(String key, RateLimitConfig config) {
        Bucket b = store.peek(key);
        if (b == null) return config.burstSize();
        return refill(b, nowSeconds(), config.requestsPerSecond(), config.burstSize());
    }

    private static double refill(Bucket b, double now, double rate, int capacity) {
        double elapsed = Math.max(0d, now - b.lastRefill());
        return Math.min(capacity, b.tokens() + elapsed * rate);
    }

    record Bucket(double tokens, double lastRefill) {}
}
