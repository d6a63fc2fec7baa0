package com.github.dimitryivaniuta.agentgateway.ratelimit;

/**
 * One rate limiting algorithm with its own per-key state.
 *
 * <p>Implementations must make check-and-update atomic per key.
 */
public interface RateLimitStrategy {

    RateLimitResult check(String key, RateLimitConfig config);

    void reset(String key);

    /**
     * Number of keys currently holding state.
     */
    long trackedKeys();
}
