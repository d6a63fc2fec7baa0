package com.github.dimitryivaniuta.agentgateway.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitConfigTest {

    @Test
    void zeroRefillRateIsRejected() {
        assertThatThrownBy(() -> RateLimitConfig.defaults().withRequestsPerSecond(0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requestsPerSecond");
    }

    @Test
    void firstMatchingOverrideWins_andBaseIsUntouched() {
        RateLimitConfig base = RateLimitConfig.defaults().withEndpointOverrides(List.of(
                EndpointOverride.perMinute("/completion", "completion", 5),
                new EndpointOverride("/", null, null, 7, null, null)
        ));

        RateLimitConfig completion = base.overrideFor("/completion/stream").orElseThrow().applyTo(base);
        RateLimitConfig other = base.overrideFor("/agents").orElseThrow().applyTo(base);

        assertThat(completion.requestsPerMinute()).isEqualTo(5);
        assertThat(completion.burstSize()).isEqualTo(base.burstSize());
        assertThat(other.requestsPerMinute()).isEqualTo(7);
        assertThat(base.requestsPerMinute()).isEqualTo(100);
    }

    @Test
    void unmatchedPathHasNoOverride_andPrefixMatchesExactPath() {
        RateLimitConfig base = RateLimitConfig.defaults()
                .withEndpointOverrides(List.of(EndpointOverride.perMinute("/completion", "completion", 5)));

        assertThat(base.overrideFor("/agents")).isEmpty();
        assertThat(base.overrideFor("/completion")).isPresent();
    }

    @Test
    void windowTierPicksMatchingLimit() {
        RateLimitConfig c = RateLimitConfig.defaults();

        assertThat(c.limitForWindow(Duration.ofMinutes(1))).isEqualTo(100);
        assertThat(c.limitForWindow(Duration.ofHours(1))).isEqualTo(1000);
    }

    @Test
    void exemptionIsExactPathMatch() {
        RateLimitConfig c = RateLimitConfig.defaults();

        assertThat(c.isExempt("/health/live")).isTrue();
        assertThat(c.isExempt("/health/live/extra")).isFalse();
        assertThat(c.isExempt("/health")).isFalse();
    }
}
