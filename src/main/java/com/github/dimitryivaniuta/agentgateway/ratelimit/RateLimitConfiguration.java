package com.github.dimitryivaniuta.agentgateway.ratelimit;

import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.agentgateway.ratelimit.strategy.FixedWindowStrategy;
import com.github.dimitryivaniuta.agentgateway.ratelimit.strategy.RateLimitStateStore;
import com.github.dimitryivaniuta.agentgateway.ratelimit.strategy.SlidingWindowStrategy;
import com.github.dimitryivaniuta.agentgateway.ratelimit.strategy.TokenBucketStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Wires the limiter: burst (token bucket), minute (sliding window) and hour (fixed or sliding window).
 *
 * Built-in scopes, in match order:
 * - /completion : RATE_LIMIT_PER_MINUTE per minute
 * - /agents     : max(30, RATE_LIMIT_PER_MINUTE / 4) per minute
 * - /health     : 60 per minute (also covers /healthz)
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfiguration {

    static final Duration MINUTE = Duration.ofMinutes(1);
    static final Duration HOUR = Duration.ofHours(1);

    @Bean
    public RateLimitConfig rateLimitConfig(RateLimitProperties props) {
        List<EndpointOverride> overrides = new ArrayList<>(builtInScopes(props));
        for (RateLimitProperties.Endpoint e : props.getEndpointOverrides()) {
            overrides.add(e.toOverride());
        }
        return new RateLimitConfig(
                props.getRequestsPerSecond(),
                props.getRequestsPerMinute(),
                props.getRequestsPerHour(),
                props.getBurstSize(),
                props.isEnabled(),
                overrides,
                new LinkedHashSet<>(props.getExemptPaths())
        );
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitConfig config,
                                   RateLimitProperties props,
                                   GatewayMetrics metrics,
                                   Clock clock) {
        long maxKeys = props.getMaxTrackedKeys();

        Map<String, RateLimitStrategy> strategies = new LinkedHashMap<>();
        strategies.put("burst", new TokenBucketStrategy(clock,
                RateLimitStateStore.Settings.of(props.getTokenBucketIdleTtl(), maxKeys)));
        strategies.put("minute", new SlidingWindowStrategy(MINUTE, clock,
                RateLimitStateStore.Settings.of(MINUTE.multipliedBy(2), maxKeys)));
        strategies.put("hour", hourStrategy(props.getHourStrategy(), clock,
                RateLimitStateStore.Settings.of(HOUR.multipliedBy(2), maxKeys)));

        log.info("Rate limiting {} (rps={}, burst={}, rpm={}, rph={}, hour tier={})",
                config.enabled() ? "enabled" : "disabled",
                config.requestsPerSecond(), config.burstSize(),
                config.requestsPerMinute(), config.requestsPerHour(), props.getHourStrategy());

        return new RateLimiter(config, strategies, new RateLimitStats(maxKeys), metrics, clock);
    }

    static List<EndpointOverride> builtInScopes(RateLimitProperties props) {
        int perMinute = Math.max(1, props.getPerMinute());
        return List.of(
                EndpointOverride.perMinute("/completion", "completion", perMinute),
                EndpointOverride.perMinute("/agents", "agents", Math.max(30, perMinute / 4)),
                EndpointOverride.perMinute("/health", "health", props.getHealthPerMinute())
        );
    }

    private static RateLimitStrategy hourStrategy(RateLimitProperties.WindowStrategyType type,
                                                  Clock clock,
                                                  RateLimitStateStore.Settings settings) {
        return switch (type) {
            case SLIDING_WINDOW -> new SlidingWindowStrategy(HOUR, clock, settings);
            case FIXED_WINDOW -> new FixedWindowStrategy(HOUR, clock, settings);
        };
    }
}
