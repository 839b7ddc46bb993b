package com.iksanov.querycache.cache.config;

import java.util.regex.Pattern;

/**
 * Connection and housekeeping settings for the Postgres-backed durable tier.
 * <p>
 * {@code connectionTimeoutMillis} bounds how long a cache call may wait for a pooled
 * connection. {@code tableName} is interpolated into SQL and is therefore restricted
 * to a plain lowercase identifier.
 */
public record DurableStoreConfig(
        boolean enabled,
        String jdbcUrl,
        String username,
        String password,
        int maxPoolSize,
        long connectionTimeoutMillis,
        String tableName,
        long reaperIntervalMillis
) {
    private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    public DurableStoreConfig {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: '" + tableName + "'");
        }
        if (enabled) {
            if (jdbcUrl == null || jdbcUrl.isBlank()) throw new IllegalArgumentException("jdbcUrl is required when durable tier is enabled");
            if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
            if (connectionTimeoutMillis < 250) throw new IllegalArgumentException("connectionTimeoutMillis must be >= 250");
            if (reaperIntervalMillis <= 0) throw new IllegalArgumentException("reaperIntervalMillis must be > 0");
        }
    }

    public static DurableStoreConfig disabled() {
        return new DurableStoreConfig(false, null, null, null, 0, 0, "query_cache", 0);
    }

    public static DurableStoreConfig defaults() {
        return new DurableStoreConfig(
                true,
                "jdbc:postgresql://localhost:5432/app",
                "app",
                "app",
                4,
                2_000,
                "query_cache",
                60_000
        );
    }

    public static DurableStoreConfig fromEnv() {
        return new DurableStoreConfig(
                getEnvBool("QUERY_CACHE_DB_ENABLED", false),
                getEnv("QUERY_CACHE_DB_URL", "jdbc:postgresql://localhost:5432/app"),
                getEnv("QUERY_CACHE_DB_USER", "app"),
                getEnv("QUERY_CACHE_DB_PASSWORD", "app"),
                getEnvInt("QUERY_CACHE_DB_POOL_SIZE", 4),
                getEnvLong("QUERY_CACHE_DB_TIMEOUT_MS", 2_000),
                getEnv("QUERY_CACHE_DB_TABLE", "query_cache"),
                getEnvLong("QUERY_CACHE_REAPER_INTERVAL_MS", 60_000)
        );
    }

    @Override
    public String toString() {
        return String.format("DurableStoreConfig[enabled=%s, url=%s, user=%s, pool=%d, timeout=%dms, table=%s, reaper=%dms]",
                enabled, jdbcUrl, username, maxPoolSize, connectionTimeoutMillis, tableName, reaperIntervalMillis);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }

    private static int getEnvInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long getEnvLong(String key, long defaultValue) {
        String value = System.getenv(key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean getEnvBool(String key, boolean defaultValue) {
        String value = System.getenv(key);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }
}
