package com.github.dimitryivaniuta.agentgateway.health;

import com.github.dimitryivaniuta.agentgateway.metrics.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs dependent-service checks concurrently and folds them into one {@link HealthSummary}.
 *
 * <p>Every check runs on {@code executor} with its own timeout, so the aggregate takes as long as the
 * slowest check (bounded by {@code checkTimeout}), not the sum. A check that throws or times out yields
 * a failed entry; nothing escapes to the caller.
 *
 * <p>The registry is fixed at construction. {@link #close()} closes {@link AutoCloseable} checks and shuts the
 * executor down.
 */
@Slf4j
public class HealthMonitor implements AutoCloseable {

    static final String NOT_REGISTERED = "No health check registered";

    private final Map<String, ServiceHealthCheck> checks;
    private final ExecutorService executor;
    private final Duration checkTimeout;
    private final Clock clock;
    private final GatewayMetrics metrics;

    public HealthMonitor(List<ServiceHealthCheck> checks,
                         ExecutorService executor,
                         Duration checkTimeout,
                         Clock clock,
                         GatewayMetrics metrics) {
        Map<String, ServiceHealthCheck> byName = new LinkedHashMap<>();
        for (ServiceHealthCheck c : checks) {
            String name = c.name().toLowerCase(Locale.ROOT);
            if (byName.putIfAbsent(name, c) != null) {
                throw new IllegalArgumentException("Duplicate health check: " + name);
            }
        }
        if (checkTimeout.isNegative() || checkTimeout.isZero()) {
            throw new IllegalArgumentException("checkTimeout must be > 0");
        }
        this.checks = byName;
        this.executor = executor;
        this.checkTimeout = checkTimeout;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Set<String> serviceNames() {
        return checks.keySet();
    }

    /**
     * Runs every registered check.
     */
    public HealthSummary summary() {
        return summarize(checks.keySet());
    }

    /**
     * Runs the named subset. A name without a registered check is reported as a failed entry.
     */
    public HealthSummary summary(Collection<String> names) {
        return summarize(names);
    }

    /**
     * Runs one check; empty if no check is registered under {@code name} (case-insensitive).
     */
    public Optional<ServiceHealth> serviceStatus(String name) {
        if (name == null) return Optional.empty();
        String key = name.toLowerCase(Locale.ROOT);
        ServiceHealthCheck check = checks.get(key);
        if (check == null) return Optional.empty();

        HealthCheckResult r = run(key, check).join();
        return Optional.of(new ServiceHealth(key, r.ok(), r.detail(), r.timestamp()));
    }

    private HealthSummary summarize(Collection<String> names) {
        Map<String, CompletableFuture<HealthCheckResult>> running = new LinkedHashMap<>();
        for (String n : names) {
            String key = n.toLowerCase(Locale.ROOT);
            if (running.containsKey(key)) continue;
            ServiceHealthCheck check = checks.get(key);
            running.put(key, check != null
                    ? run(key, check)
                    : CompletableFuture.completedFuture(new HealthCheckResult(false, NOT_REGISTERED, clock.instant())));
        }

        CompletableFuture.allOf(running.values().toArray(new CompletableFuture<?>[0])).join();

        Map<String, HealthCheckResult> results = new LinkedHashMap<>();
        running.forEach((key, f) -> results.put(key, f.join()));
        return HealthSummary.of(results, clock.instant());
    }

    // never completes exceptionally; a check still running at the timeout is interrupted
    private CompletableFuture<HealthCheckResult> run(String name, ServiceHealthCheck check) {
        long start = System.nanoTime();
        CompletableFuture<ServiceHealthCheck.Outcome> outcome = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                outcome.complete(check.check());
            } catch (RuntimeException e) {
                outcome.completeExceptionally(e);
            }
        });
        return outcome
                .orTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, ex) -> {
                    if (ex != null) task.cancel(true);
                    ServiceHealthCheck.Outcome o = (ex == null) ? result : failure(ex);
                    if (o == null) o = ServiceHealthCheck.Outcome.down("Unexpected error: check returned no result");

                    metrics.recordHealthCheck(name, System.nanoTime() - start);
                    if (!o.ok()) {
                        metrics.healthCheckFailed(name);
                        log.warn("Health check {} failed: {}", name, o.detail());
                    }
                    return new HealthCheckResult(o.ok(), o.detail(), clock.instant());
                });
    }

    private ServiceHealthCheck.Outcome failure(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return ServiceHealthCheck.Outcome.down("Timed out after " + checkTimeout.toMillis() + " ms");
        }
        String msg = cause.getMessage();
        return ServiceHealthCheck.Outcome.down("Unexpected error: " + (msg != null ? msg : cause.getClass().getSimpleName()));
    }

    @Override
    public void close() {
        for (ServiceHealthCheck c : checks.values()) {
            if (c instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Failed to close health check {}", c.name(), e);
                }
            }
        }
        executor.shutdownNow();
    }
}
