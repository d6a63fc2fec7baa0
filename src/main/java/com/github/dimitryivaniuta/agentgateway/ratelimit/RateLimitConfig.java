package com.github.dimitryivaniuta.agentgateway.ratelimit;

import lombok.With;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rate limit policy for one scope.
 *
 * <p>Immutable. A matching {@link EndpointOverride} derives a new config with
 * {@link EndpointOverride#applyTo(RateLimitConfig)}; the base instance is never modified.
 *
 * @param requestsPerSecond token bucket refill rate, must be positive
 * @param requestsPerMinute limit of the one-minute window tier
 * @param requestsPerHour   limit of the one-hour window tier
 * @param burstSize         token bucket capacity
 * @param enabled           when false every check is allowed
 * @param endpointOverrides ordered path-prefix overrides, first match wins
 * @param exemptPaths       exact paths that are never limited
 */
@With
public record RateLimitConfig(
        double requestsPerSecond,
        int requestsPerMinute,
        int requestsPerHour,
        int burstSize,
        boolean enabled,
        List<EndpointOverride> endpointOverrides,
        Set<String> exemptPaths
) {

    public static final Set<String> DEFAULT_EXEMPT_PATHS =
            Set.of("/health/live", "/health/ready", "/metrics");

    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);

    public RateLimitConfig {
        if (!(requestsPerSecond > 0) || Double.isInfinite(requestsPerSecond)) {
            throw new IllegalArgumentException("requestsPerSecond must be a positive finite number: " + requestsPerSecond);
        }
        if (requestsPerMinute < 0) throw new IllegalArgumentException("requestsPerMinute < 0");
        if (requestsPerHour < 0) throw new IllegalArgumentException("requestsPerHour < 0");
        if (burstSize < 1) throw new IllegalArgumentException("burstSize must be >= 1");
        endpointOverrides = (endpointOverrides == null) ? List.of() : List.copyOf(endpointOverrides);
        exemptPaths = (exemptPaths == null) ? DEFAULT_EXEMPT_PATHS : Set.copyOf(exemptPaths);
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(10.0, 100, 1000, 20, true, List.of(), DEFAULT_EXEMPT_PATHS);
    }

    public boolean isExempt(String path) {
        return exemptPaths.contains(path);
    }

    /**
     * Finds the first override whose prefix matches the path.
     */
    public Optional<EndpointOverride> overrideFor(String path) {
        if (path == null) return Optional.empty();
        for (EndpointOverride o : endpointOverrides) {
            if (o.matches(path)) return Optional.of(o);
        }
        return Optional.empty();
    }

    /**
     * Window tiers: exactly one minute reads the per-minute limit, any other window the per-hour limit.
     */
    public int limitForWindow(Duration window) {
        return ONE_MINUTE.equals(window) ? requestsPerMinute : requestsPerHour;
    }
}
