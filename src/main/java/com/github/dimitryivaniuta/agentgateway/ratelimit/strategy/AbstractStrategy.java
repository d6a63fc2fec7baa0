package com.github.dimitryivaniuta.agentgateway.ratelimit.strategy;

import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitStrategy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Shared plumbing for the in-memory strategies: a clock read as fractional epoch seconds
 * and a bounded state store.
 */
abstract class AbstractStrategy<S> implements RateLimitStrategy {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    protected final Clock clock;
    protected final RateLimitStateStore<S> store;

    protected AbstractStrategy(Clock clock, RateLimitStateStore.Settings settings) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.store = new RateLimitStateStore<>(settings);
    }

    protected final double nowSeconds() {
        Instant now = clock.instant();
        return now.getEpochSecond() + now.getNano() / NANOS_PER_SECOND;
    }

    protected static Instant toInstant(double epochSeconds) {
        long secs = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - secs) * NANOS_PER_SECOND);
        return Instant.ofEpochSecond(secs, nanos);
    }

    protected static Duration seconds(double seconds) {
        return Duration.ofNanos(Math.round(Math.max(0d, seconds) * NANOS_PER_SECOND));
    }

    @Override
    public void reset(String key) {
        store.remove(key);
    }

    @Override
    public long trackedKeys() {
        return store.size();
    }
}
