package com.github.dimitryivaniuta.agentgateway.ratelimit.strategy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Bounded per-key state for a strategy.
 *
 * Keys idle for longer than {@code idleTtl} expire, and at most {@code maxKeys} are kept.
 * Updates run inside {@link ConcurrentMap#compute}, so one key is never updated by two threads at once.
 *
 * @param <S> state type, treated as owned by the store once handed to {@link #update}
 */
public final class RateLimitStateStore<S> {

    private final Cache<String, S> cache;
    private final ConcurrentMap<String, S> map;

    public RateLimitStateStore(Settings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(settings.maxKeys())
                .expireAfterAccess(settings.idleTtl());
        if (settings.ticker() != null) {
            builder = builder.ticker(settings.ticker()).executor(Runnable::run);
        }
        this.cache = builder.build();
        this.map = cache.asMap();
    }

    /**
     * Atomically transforms the state of {@code key}. The function receives null for an unseen key
     * and returns the new state together with the value handed back to the caller.
     */
    public <R> R update(String key, Function<S, Update<S, R>> fn) {
        Object[] out = new Object[1];
        map.compute(key, (k, current) -> {
            Update<S, R> u = fn.apply(current);
            out[0] = u.result();
            return u.state();
        });
        @SuppressWarnings("unchecked")
        R result = (R) out[0];
        return result;
    }

    public S peek(String key) {
        return cache.getIfPresent(key);
    }

    public void remove(String key) {
        cache.invalidate(key);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public record Update<S, R>(S state, R result) {}

    /**
     * @param idleTtl expiry after last access
     * @param maxKeys hard cap on tracked keys
     * @param ticker  time source for expiry, null for the system ticker
     */
    public record Settings(Duration idleTtl, long maxKeys, Ticker ticker) {

        public Settings {
            if (idleTtl == null || idleTtl.isNegative() || idleTtl.isZero()) {
                throw new IllegalArgumentException("idleTtl must be positive");
            }
            if (maxKeys <= 0) throw new IllegalArgumentException("maxKeys must be > 0");
        }

        public static Settings of(Duration idleTtl, long maxKeys) {
            return new Settings(idleTtl, maxKeys, null);
        }
    }
}
