package com.github.dimitryivaniuta.agentgateway.health;

import java.time.Instant;

public record HealthCheckResult(boolean ok, String detail, Instant timestamp) {}
