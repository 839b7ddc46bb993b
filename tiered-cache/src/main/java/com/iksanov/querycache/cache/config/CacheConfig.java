package com.iksanov.querycache.cache.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Top-level cache configuration.
 * Immutable; build with one of the profiles or {@link #fromEnv()}.
 */
public record CacheConfig(
        Duration defaultTtl,
        Duration sweepInterval,
        DurableStoreConfig durable
) {
    public CacheConfig {
        Objects.requireNonNull(durable, "durable");
        requirePositive(defaultTtl, "defaultTtl");
        requirePositive(sweepInterval, "sweepInterval");
    }

    /** Database query results: short TTL, frequent sweep. */
    public static CacheConfig queryDefaults() {
        return new CacheConfig(Duration.ofMinutes(5), Duration.ofSeconds(60), DurableStoreConfig.disabled());
    }

    /** Expensive computed analyses: one day TTL, hourly sweep. */
    public static CacheConfig computedDefaults() {
        return new CacheConfig(Duration.ofHours(24), Duration.ofHours(1), DurableStoreConfig.disabled());
    }

    public static CacheConfig fromEnv() {
        return new CacheConfig(
                Duration.ofSeconds(getEnvLong("QUERY_CACHE_DEFAULT_TTL_SECONDS", 300)),
                Duration.ofSeconds(getEnvLong("QUERY_CACHE_SWEEP_INTERVAL_SECONDS", 60)),
                DurableStoreConfig.fromEnv()
        );
    }

    public CacheConfig withDurable(DurableStoreConfig durable) {
        return new CacheConfig(defaultTtl, sweepInterval, durable);
    }

    @Override
    public String toString() {
        return String.format("CacheConfig[defaultTtl=%ss, sweep=%ss, %s]",
                defaultTtl.toSeconds(), sweepInterval.toSeconds(), durable);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    private static long getEnvLong(String key, long def) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) return def;
        try { return Long.parseLong(v); } catch (Exception e) { return def; }
    }
}
