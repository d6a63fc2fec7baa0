package com.github.dimitryivaniuta.agentgateway.ratelimit;

/**
 * Per-endpoint limits. Any null limit falls back to the base config.
 *
 * @param pathPrefix        matched with {@code path.startsWith(pathPrefix)}
 * @param scope             optional policy bucket name; requests matched by a scoped override
 *                          keep counters separate from other scopes
 * @param requestsPerSecond token refill rate override
 * @param requestsPerMinute minute tier override
 * @param requestsPerHour   hour tier override
 * @param burstSize         bucket capacity override
 */
public record EndpointOverride(
        String pathPrefix,
        String scope,
        Double requestsPerSecond,
        Integer requestsPerMinute,
        Integer requestsPerHour,
        Integer burstSize
) {

    public EndpointOverride {
        if (pathPrefix == null || pathPrefix.isBlank()) {
            throw new IllegalArgumentException("pathPrefix must not be blank");
        }
        if (scope != null && scope.isBlank()) scope = null;
    }

    public static EndpointOverride perMinute(String pathPrefix, String scope, int requestsPerMinute) {
        return new EndpointOverride(pathPrefix, scope, null, requestsPerMinute, null, null);
    }

    public boolean matches(String path) {
        return path.startsWith(pathPrefix);
    }

    public RateLimitConfig applyTo(RateLimitConfig base) {
        return new RateLimitConfig(
                requestsPerSecond != null ? requestsPerSecond : base.requestsPerSecond(),
                requestsPerMinute != null ? requestsPerMinute : base.requestsPerMinute(),
                requestsPerHour != null ? requestsPerHour : base.requestsPerHour(),
                burstSize != null ? burstSize : base.burstSize(),
                base.enabled(),
                base.endpointOverrides(),
                base.exemptPaths()
        );
    }
}
