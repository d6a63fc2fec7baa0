package com.github.dimitryivaniuta.agentgateway.retry;

import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded exponential-backoff retry around one upstream call.
 *
 * <p>The wait before retry {@code n} (counted from 0) is {@code min(maxWait, minWait * 2^n)}.
 * Failures the predicate rejects are rethrown on the first attempt. When attempts run out the last
 * failure is rethrown as is.
 */
@Slf4j
public final class RetryPolicy {

    private final String name;
    private final Settings settings;
    private final Predicate<Throwable> retryable;
    private final Retry retry;
    private final GatewayMetrics metrics;

    private RetryPolicy(String name, Settings settings, Predicate<Throwable> retryable, GatewayMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.retryable = Objects.requireNonNull(retryable, "retryable must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.minWait(), 2.0, settings.maxWait()))
                .retryOnException(retryable)
                .build();

        this.retry = Retry.of("retry:" + name, config);
        this.retry.getEventPublisher().onRetry(e -> log.warn(
                "Retrying {} (attempt {}/{}) in {} ms after: {}",
                name, e.getNumberOfRetryAttempts() + 1, settings.maxAttempts(),
                e.getWaitInterval().toMillis(), String.valueOf(e.getLastThrowable())));
    }

    public static RetryPolicy of(String name, Settings settings, Predicate<Throwable> retryable, GatewayMetrics metrics) {
        return new RetryPolicy(name, settings, retryable, metrics);
    }

    /**
     * Policy for upstream LLM calls: transient network and HTTP failures only.
     */
    public static RetryPolicy forUpstream(String name, Settings settings, GatewayMetrics metrics) {
        return new RetryPolicy(name, settings, TransientFailureClassifier.INSTANCE, metrics);
    }

    public String name() {
        return name;
    }

    public Settings settings() {
        return settings;
    }

    public <T> T call(Supplier<T> upstreamCall) {
        metrics.retryCall(name);
        try {
            return Retry.decorateSupplier(retry, () -> {
                metrics.retryAttempt(name);
                return upstreamCall.get();
            }).get();
        } catch (RuntimeException ex) {
            recordFailure(ex);
            throw ex;
        }
    }

    /**
     * Variant for calls declaring checked exceptions, e.g. a proxied method invocation.
     */
    public <T> T execute(CheckedSupplier<T> upstreamCall) throws Throwable {
        metrics.retryCall(name);
        try {
            return Retry.decorateCheckedSupplier(retry, () -> {
                metrics.retryAttempt(name);
                return upstreamCall.get();
            }).get();
        } catch (Throwable ex) {
            recordFailure(ex);
            throw ex;
        }
    }

    private void recordFailure(Throwable ex) {
        if (retryable.test(ex)) {
            metrics.retryExhausted(name);
            log.warn("Giving up on {} after {} attempts: {}", name, settings.maxAttempts(), ex.toString());
        }
    }

    /**
     * @param maxAttempts total attempts including the first call
     * @param minWait     first backoff
     * @param maxWait     backoff ceiling
     */
    public record Settings(int maxAttempts, Duration minWait, Duration maxWait) {

        public static final Settings LLM_DEFAULTS = new Settings(3, Duration.ofSeconds(2), Duration.ofSeconds(10));

        public Settings {
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
            if (minWait == null || minWait.toMillis() < 1) throw new IllegalArgumentException("minWait must be >= 1 ms");
            if (maxWait == null || maxWait.compareTo(minWait) < 0) {
                throw new IllegalArgumentException("maxWait must be >= minWait");
            }
        }

        /**
         * Wait before retry number {@code attempt}, counted from 0.
         */
        public Duration backoff(int attempt) {
            if (attempt < 0) throw new IllegalArgumentException("attempt < 0");
            long factor = (attempt >= 62) ? Long.MAX_VALUE : (1L << attempt);
            long millis = (minWait.toMillis() > maxWait.toMillis() / factor)
                    ? maxWait.toMillis()
                    : minWait.toMillis() * factor;
            return Duration.ofMillis(Math.min(maxWait.toMillis(), millis));
        }
    }
}
