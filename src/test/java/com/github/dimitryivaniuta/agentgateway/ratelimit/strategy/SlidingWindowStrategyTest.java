package com.github.dimitryivaniuta.agentgateway.ratelimit.strategy;

import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitConfig;
import com.github.dimitryivaniuta.agentgateway.ratelimit.RateLimitResult;
import com.github.dimitryivaniuta.agentgateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SlidingWindowStrategyTest {

    private MutableClock clock;
    private SlidingWindowStrategy minute;
    private RateLimitConfig config;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        minute = new SlidingWindowStrategy(Duration.ofMinutes(1), clock,
                RateLimitStateStore.Settings.of(Duration.ofMinutes(2), 1_000));
        config = RateLimitConfig.defaults().withRequestsPerMinute(3);
    }

    @Test
    void limitReached_deniesUntilOldestEntryLeavesWindow() {
        minute.check("k", config);
        clock.advance(Duration.ofSeconds(10));
        minute.check("k", config);
        clock.advance(Duration.ofSeconds(10));
        RateLimitResult last = minute.check("k", config);
        assertThat(last.allowed()).isTrue();
        assertThat(last.remaining()).isZero();

        clock.advance(Duration.ofSeconds(5));
        RateLimitResult denied = minute.check("k", config);

        assertThat(denied.allowed()).isFalse();
        // oldest at t=0, now t=25
        assertThat(denied.retryAfterSeconds()).isCloseTo(35.0, within(1e-5));
        assertThat(denied.limit()).isEqualTo(3);
    }

    @Test
    void entryExactlyOneWindowOld_isPruned() {
        for (int i = 0; i < 3; i++) minute.check("k", config);
        assertThat(minute.check("k", config).allowed()).isFalse();

        clock.advance(Duration.ofSeconds(60));

        RateLimitResult r = minute.check("k", config);
        assertThat(r.allowed()).isTrue();
        assertThat(r.remaining()).isEqualTo(2);
    }

    @Test
    void noDoubleBurstAcrossCalendarBoundary() {
        // three requests just before a minute boundary, three more just after
        clock.set(clock.instant().plusSeconds(59));
        for (int i = 0; i < 3; i++) assertThat(minute.check("k", config).allowed()).isTrue();

        clock.advance(Duration.ofSeconds(2));
        for (int i = 0; i < 3; i++) assertThat(minute.check("k", config).allowed()).isFalse();
    }

    @Test
    void deniedRequestsAreNotRecorded() {
        for (int i = 0; i < 3; i++) minute.check("k", config);
        for (int i = 0; i < 5; i++) minute.check("k", config);

        clock.advance(Duration.ofSeconds(61));
        for (int i = 0; i < 3; i++) assertThat(minute.check("k", config).allowed()).isTrue();
    }

    @Test
    void hourWindowReadsHourlyLimit() {
        SlidingWindowStrategy hour = new SlidingWindowStrategy(Duration.ofHours(1), clock,
                RateLimitStateStore.Settings.of(Duration.ofHours(2), 1_000));
        RateLimitConfig c = config.withRequestsPerHour(1);

        assertThat(hour.check("k", c).allowed()).isTrue();
        assertThat(hour.check("k", c).allowed()).isFalse();
    }

    @Test
    void rejectsNonPositiveWindow() {
        RateLimitStateStore.Settings settings = RateLimitStateStore.Settings.of(Duration.ofMinutes(1), 10);
        assertThatThrownBy(() -> new SlidingWindowStrategy(Duration.ZERO, clock, settings))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
