package com.github.dimitryivaniuta.agentgateway.ratelimit;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "agent-gateway.rate-limit")
public class RateLimitProperties {

    public enum WindowStrategyType { FIXED_WINDOW, SLIDING_WINDOW }

    private boolean enabled = true;

    // base policy
    private double requestsPerSecond = 10.0;
    private int requestsPerMinute = 100;
    private int requestsPerHour = 1000;
    private int burstSize = 20;

    /**
     * RATE_LIMIT_PER_MINUTE. Completion scope gets this value, the agents scope a quarter of it (at least 30).
     */
    private int perMinute = 120;
    private int healthPerMinute = 60;

    private List<String> exemptPaths = new ArrayList<>(List.of("/health/live", "/health/ready", "/metrics"));

    /**
     * Extra overrides, matched after the built-in completion/agents/health scopes.
     */
    private List<Endpoint> endpointOverrides = new ArrayList<>();

    /**
     * Fixed windows let up to 2x the hourly limit through around a boundary; sliding windows do not
     * but keep one timestamp per request.
     */
    private WindowStrategyType hourStrategy = WindowStrategyType.FIXED_WINDOW;

    private Duration tokenBucketIdleTtl = Duration.ofHours(1);
    private long maxTrackedKeys = 100_000;

    // X-Forwarded-For / X-Real-IP are only honoured behind a trusted proxy
    private boolean trustForwardedHeaders = false;

    private Admin admin = new Admin();

    /**
     * {@code /rate-limit/stats} and {@code /rate-limit/keys/{key}}. Off unless enabled, and then every call
     * must carry {@code X-Admin-Token}.
     */
    @Getter
    @Setter
    public static class Admin {
        private boolean enabled = false;
        private String token;
    }

    @Getter
    @Setter
    public static class Endpoint {
        private String path;
        private String scope;
        private Double requestsPerSecond;
        private Integer requestsPerMinute;
        private Integer requestsPerHour;
        private Integer burstSize;

        EndpointOverride toOverride() {
            return new EndpointOverride(path, scope, requestsPerSecond, requestsPerMinute, requestsPerHour, burstSize);
        }
    }
}
