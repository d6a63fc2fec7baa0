package com.github.dimitryivaniuta.agentgateway.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one rate limit check.
 *
 * <p>Allowed results never carry a retry-after; denied results never report positive remaining quota.
 */
public record RateLimitResult(
        boolean allowed,
        int remaining,
        Instant resetAt,
        Duration retryAfter,
        int limit
) {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    static final int UNLIMITED = 999;

    public RateLimitResult {
        if (resetAt == null) throw new IllegalArgumentException("resetAt must not be null");
        if (allowed && retryAfter != null) {
            throw new IllegalArgumentException("allowed result must not carry retryAfter");
        }
        if (!allowed && remaining > 0) {
            throw new IllegalArgumentException("denied result must not report remaining > 0");
        }
        if (!allowed && retryAfter == null) {
            retryAfter = Duration.ZERO;
        }
        if (retryAfter != null && retryAfter.isNegative()) {
            retryAfter = Duration.ZERO;
        }
    }

    public static RateLimitResult allow(int remaining, Instant resetAt, int limit) {
        return new RateLimitResult(true, remaining, resetAt, null, limit);
    }

    public static RateLimitResult deny(Instant resetAt, Duration retryAfter, int limit) {
        return new RateLimitResult(false, 0, resetAt, retryAfter, limit);
    }

    /**
     * Result used when limiting is disabled or the path is exempt.
     */
    public static RateLimitResult unlimited(Instant now) {
        return allow(UNLIMITED, now.plus(Duration.ofHours(1)), UNLIMITED);
    }

    public double retryAfterSeconds() {
        return retryAfter == null ? 0.0 : retryAfter.toNanos() / 1_000_000_000d;
    }

    /**
     * Whole seconds for the Retry-After header: rounded up, never below one.
     */
    public long retryAfterHeaderSeconds() {
        return Math.max(1L, (long) Math.ceil(retryAfterSeconds()));
    }

    public Map<String, String> toHeaders() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(HEADER_LIMIT, String.valueOf(limit));
        h.put(HEADER_REMAINING, String.valueOf(Math.max(0, remaining)));
        h.put(HEADER_RESET, String.valueOf(resetAt.getEpochSecond()));
        if (!allowed) {
            h.put(HEADER_RETRY_AFTER, String.valueOf(retryAfterHeaderSeconds()));
        }
        return h;
    }
}
