package com.github.dimitryivaniuta.agentgateway.health;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate over a set of checks: {@code healthy} iff every entry is ok (vacuously true when empty).
 */
public record HealthSummary(String status, Instant timestamp, Map<String, HealthCheckResult> services) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    public static HealthSummary of(Map<String, HealthCheckResult> services, Instant timestamp) {
        boolean allOk = services.values().stream().allMatch(HealthCheckResult::ok);
        return new HealthSummary(
                allOk ? HEALTHY : DEGRADED,
                timestamp,
                Collections.unmodifiableMap(new LinkedHashMap<>(services))
        );
    }

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
