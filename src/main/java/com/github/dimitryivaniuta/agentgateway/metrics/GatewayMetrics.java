package com.github.dimitryivaniuta.agentgateway.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Rate limiting ----
    public void rateLimitRejected(String strategy, String subjectType) {
        Counter.builder("agent_gateway_ratelimit_rejected_total")
                .tag("strategy", strategy) // burst | minute | hour
                .tag("subject", subjectType) // user | ip
                .register(registry)
                .increment();
    }

    public void rateLimitAllowed(String subjectType) {
        Counter.builder("agent_gateway_ratelimit_allowed_total")
                .tag("subject", subjectType)
                .register(registry)
                .increment();
    }

    // ---- Retry ----
    public void retryCall(String callName) {
        Counter.builder("agent_gateway_retry_calls_total")
                .tag("call", callName)
                .register(registry)
                .increment();
    }

    public void retryAttempt(String callName) {
        Counter.builder("agent_gateway_retry_attempts_total")
                .tag("call", callName)
                .register(registry)
                .increment();
    }

    public void retryExhausted(String callName) {
        Counter.builder("agent_gateway_retry_exhausted_total")
                .tag("call", callName)
                .register(registry)
                .increment();
    }

    // ---- Completions ----
    public void recordCompletion(String agent, String outcome, long nanos) {
        Timer.builder("agent_gateway_completion_duration_seconds")
                .tag("agent", agent)
                .tag("outcome", outcome) // success | error
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---- Health ----
    public void healthCheckFailed(String service) {
        Counter.builder("agent_gateway_health_check_failures_total")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void recordHealthCheck(String service, long nanos) {
        Timer.builder("agent_gateway_health_check_duration_seconds")
                .tag("service", service)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
