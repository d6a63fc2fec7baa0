package com.github.dimitryivaniuta.agentgateway.ratelimit;

import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs a request through every configured strategy in order.
 *
 * <p>The first denial short-circuits: later strategies are not consulted and keep their state.
 * When all strategies allow, the result with the least remaining quota is returned.
 * A strategy failure denies the request.
 */
@Slf4j
public class RateLimiter {

    private static final Duration FAIL_CLOSED_RETRY = Duration.ofSeconds(1);

    private final RateLimitConfig config;
    private final Map<String, RateLimitStrategy> strategies;
    private final RateLimitStats stats;
    private final GatewayMetrics metrics;
    private final Clock clock;

    public RateLimiter(RateLimitConfig config,
                       Map<String, RateLimitStrategy> strategies,
                       RateLimitStats stats,
                       GatewayMetrics metrics,
                       Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }
        this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RateLimitConfig config() {
        return config;
    }

    public Map<String, RateLimitStrategy> strategies() {
        return strategies;
    }

    public RateLimitResult check(RateLimitRequest request) {
        return check(request, null);
    }

    public RateLimitResult check(RateLimitRequest request, Function<RateLimitRequest, String> keyFunc) {
        stats.recordRequest();

        if (!config.enabled() || config.isExempt(request.path())) {
            return RateLimitResult.unlimited(clock.instant());
        }

        String identity = (keyFunc != null) ? keyFunc.apply(request) : request.defaultKey();
        Optional<EndpointOverride> override = config.overrideFor(request.path());
        RateLimitConfig effective = override.map(o -> o.applyTo(config)).orElse(config);
        String key = override.map(EndpointOverride::scope).map(s -> s + ":" + identity).orElse(identity);

        RateLimitResult mostRestrictive = null;
        for (Map.Entry<String, RateLimitStrategy> e : strategies.entrySet()) {
            String strategyName = e.getKey();
            RateLimitResult result;
            try {
                result = e.getValue().check(key + ":" + strategyName, effective);
            } catch (RuntimeException ex) {
                log.error("Rate limit strategy '{}' failed for {}; denying request", strategyName, key, ex);
                result = RateLimitResult.deny(clock.instant().plus(FAIL_CLOSED_RETRY), FAIL_CLOSED_RETRY, 0);
            }

            if (!result.allowed()) {
                stats.recordDenied(key);
                metrics.rateLimitRejected(strategyName, request.subjectType());
                log.warn("Rate limit exceeded for {} on {} ({})", key, request.path(), strategyName);
                return result;
            }
            if (mostRestrictive == null || result.remaining() < mostRestrictive.remaining()) {
                mostRestrictive = result;
            }
        }

        stats.recordAllowed(key);
        metrics.rateLimitAllowed(request.subjectType());
        return mostRestrictive;
    }

    /**
     * Clears the state of {@code key} in every strategy. Scoped keys must include their scope prefix.
     */
    public void reset(String key) {
        strategies.forEach((name, strategy) -> strategy.reset(key + ":" + name));
    }

    public RateLimitStats.Snapshot stats() {
        return stats.snapshot();
    }
}
