package com.github.dimitryivaniuta.agentgateway.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;

/**
 * Best-effort counters. Increments are not coordinated with the limiter's state updates.
 */
public final class RateLimitStats {

    private static final int TOP_DENIED = 10;

    private final LongAdder total = new LongAdder();
    private final LongAdder allowed = new LongAdder();
    private final LongAdder denied = new LongAdder();

    // per-key counters are capped like strategy state
    private final Cache<String, KeyCounters> byKey;

    public RateLimitStats(long maxTrackedKeys) {
        this.byKey = Caffeine.newBuilder().maximumSize(maxTrackedKeys).build();
    }

    void recordRequest() {
        total.increment();
    }

    void recordAllowed(String key) {
        allowed.increment();
        byKey.get(key, k -> new KeyCounters()).allowed.increment();
    }

    void recordDenied(String key) {
        denied.increment();
        byKey.get(key, k -> new KeyCounters()).denied.increment();
    }

    public Snapshot snapshot() {
        long t = total.sum();
        long d = denied.sum();
        List<KeyDenials> top = byKey.asMap().entrySet().stream()
                .map(e -> new KeyDenials(e.getKey(), e.getValue().denied.sum()))
                .filter(k -> k.denied() > 0)
                .sorted(Comparator.comparingLong(KeyDenials::denied).reversed())
                .limit(TOP_DENIED)
                .toList();
        return new Snapshot(t, allowed.sum(), d, t > 0 ? (double) d / t : 0d, top);
    }

    private static final class KeyCounters {
        final LongAdder allowed = new LongAdder();
        final LongAdder denied = new LongAdder();
    }

    public record KeyDenials(String key, long denied) {}

    public record Snapshot(
            long totalRequests,
            long allowedRequests,
            long deniedRequests,
            double denialRate,
            List<KeyDenials> topDenied
    ) {}
}
