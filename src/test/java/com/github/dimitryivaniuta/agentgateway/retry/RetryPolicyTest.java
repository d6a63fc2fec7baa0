package com.github.dimitryivaniuta.agentgateway.retry;

import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    // tiny waits keep the suite fast; backoff math is covered separately
    private static final RetryPolicy.Settings FAST = new RetryPolicy.Settings(3, Duration.ofMillis(1), Duration.ofMillis(5));

    private SimpleMeterRegistry registry;
    private GatewayMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GatewayMetrics(registry);
    }

    @Test
    void permanentFailureIsAttemptedOnce() {
        RetryPolicy policy = RetryPolicy.forUpstream("test", FAST, metrics);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.call(() -> {
            calls.incrementAndGet();
            throw HttpClientErrorException.create(HttpStatus.NOT_FOUND, "Not Found", null, null, null);
        })).isInstanceOf(HttpClientErrorException.NotFound.class);

        assertThat(calls).hasValue(1);
        assertThat(counter("agent_gateway_retry_exhausted_total")).isZero();
    }

    @Test
    void transientFailuresAreRetriedUntilSuccess() {
        RetryPolicy policy = RetryPolicy.forUpstream("test", FAST, metrics);
        AtomicInteger calls = new AtomicInteger();

        String result = policy.call(() -> {
            if (calls.incrementAndGet() < 3) {
                throw HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE, "Unavailable", null, null, null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(counter("agent_gateway_retry_attempts_total")).isEqualTo(3.0);
        assertThat(counter("agent_gateway_retry_calls_total")).isEqualTo(1.0);
    }

    @Test
    void exhaustionRethrowsLastFailureUnwrapped() {
        RetryPolicy policy = RetryPolicy.forUpstream("test", FAST, metrics);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.call(() -> {
            throw new ResourceAccessException("attempt " + calls.incrementAndGet(), new ConnectException("refused"));
        }))
                .isInstanceOf(ResourceAccessException.class)
                .hasMessage("attempt 3")
                .hasCauseInstanceOf(ConnectException.class);

        assertThat(calls).hasValue(3);
        assertThat(counter("agent_gateway_retry_exhausted_total")).isEqualTo(1.0);
    }

    @Test
    void singleAttemptPolicyNeverRetries() {
        RetryPolicy policy = RetryPolicy.forUpstream("test",
                new RetryPolicy.Settings(1, Duration.ofMillis(1), Duration.ofMillis(1)), metrics);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.call(() -> {
            calls.incrementAndGet();
            throw new ResourceAccessException("down");
        })).isInstanceOf(ResourceAccessException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void backoffDoublesAndIsCapped() {
        RetryPolicy.Settings s = RetryPolicy.Settings.LLM_DEFAULTS;

        assertThat(s.backoff(0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(s.backoff(1)).isEqualTo(Duration.ofSeconds(4));
        assertThat(s.backoff(2)).isEqualTo(Duration.ofSeconds(8));
        assertThat(s.backoff(3)).isEqualTo(Duration.ofSeconds(10));
        assertThat(s.backoff(70)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> new RetryPolicy.Settings(0, Duration.ofSeconds(1), Duration.ofSeconds(2)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy.Settings(3, Duration.ofSeconds(5), Duration.ofSeconds(2)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private double counter(String name) {
        var c = registry.find(name).tag("call", "test").counter();
        return c == null ? 0.0 : c.count();
    }
}
