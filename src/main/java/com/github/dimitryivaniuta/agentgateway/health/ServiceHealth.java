package com.github.dimitryivaniuta.agentgateway.health;

import java.time.Instant;

/**
 * Result of a single named check, as returned by {@code GET /healthz/{service}}.
 */
public record ServiceHealth(String service, boolean ok, String detail, Instant timestamp) {}
