package com.iksanov.querycache.cache.durable;

import com.iksanov.querycache.common.codec.JsonValueCodec;
import com.iksanov.querycache.common.exception.PersistenceUnavailableException;
import com.iksanov.querycache.common.util.TtlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Postgres-backed DurableStore.
 * Table DDL (table name is configurable):
 * CREATE TABLE IF NOT EXISTS query_cache (
 *   cache_key  TEXT PRIMARY KEY,
 *   namespace  TEXT NOT NULL,
 *   payload    TEXT NOT NULL,
 *   created_at TIMESTAMPTZ NOT NULL,
 *   expires_at TIMESTAMPTZ NOT NULL
 * );
 */
public class PostgresDurableStore implements DurableStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresDurableStore.class);

    private static final Duration MIN_TTL = Duration.ofMillis(1);

    private final DataSource ds;
    private final String table;
    private final JsonValueCodec codec;
    private final Clock clock;

    public PostgresDurableStore(DataSource ds, String table) {
        this(ds, table, new JsonValueCodec(), Clock.systemUTC());
    }

    public PostgresDurableStore(DataSource ds, String table, JsonValueCodec codec, Clock clock) {
        this.ds = Objects.requireNonNull(ds, "ds");
        this.table = Objects.requireNonNull(table, "table");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void initSchema() {
        final String[] ddl = {
                "CREATE TABLE IF NOT EXISTS " + table + " (" +
                        "cache_key TEXT PRIMARY KEY, " +
                        "namespace TEXT NOT NULL, " +
                        "payload TEXT NOT NULL, " +
                        "created_at TIMESTAMPTZ NOT NULL, " +
                        "expires_at TIMESTAMPTZ NOT NULL)",
                "CREATE INDEX IF NOT EXISTS " + table + "_namespace_idx ON " + table + " (namespace)",
                "CREATE INDEX IF NOT EXISTS " + table + "_expires_idx ON " + table + " (expires_at)"
        };
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String sql : ddl) st.execute(sql);
            log.info("Durable cache schema ready (table={})", table);
        } catch (SQLException e) {
            throw new PersistenceUnavailableException("Failed to initialize durable cache schema", e);
        }
    }

    @Override
    public CacheEntry get(String key) {
        final String sql = "SELECT cache_key, namespace, payload, created_at, expires_at FROM " + table + " WHERE cache_key = ?";
        try (Connection c = ds.getConnection()) {
            String cacheKey, namespace, payload;
            Instant createdAt, expiresAt;
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return null;
                    cacheKey = rs.getString(1);
                    namespace = rs.getString(2);
                    payload = rs.getString(3);
                    createdAt = rs.getTimestamp(4).toInstant();
                    expiresAt = rs.getTimestamp(5).toInstant();
                }
            }

            // Rows whose expiry does not follow creation (timestamp truncation, foreign writers) are never served.
            Instant now = clock.instant();
            if (!expiresAt.isAfter(now) || !expiresAt.isAfter(createdAt)) {
                reapExpired(c, key, now);
                return null;
            }
            return new CacheEntry(cacheKey, namespace, payload, createdAt, expiresAt);
        } catch (SQLException e) {
            throw new PersistenceUnavailableException("Failed to read key " + key + " from durable cache", e);
        }
    }

    @Override
    public void put(String key, Object value, String namespace, Duration ttl) {
        TtlUtils.requirePositive(ttl);
        String payload = codec.encode(value);
        Instant createdAt = clock.instant();
        // TIMESTAMPTZ keeps microseconds, so sub-millisecond TTLs are rounded up like the fast tier does.
        Instant expiresAt = createdAt.plus(ttl.compareTo(MIN_TTL) < 0 ? MIN_TTL : ttl);

        final String sql = "INSERT INTO " + table + " (cache_key, namespace, payload, created_at, expires_at) VALUES (?, ?, ?, ?, ?) " +
                           "ON CONFLICT (cache_key) DO UPDATE SET namespace = EXCLUDED.namespace, payload = EXCLUDED.payload, " +
                           "created_at = EXCLUDED.created_at, expires_at = EXCLUDED.expires_at";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, namespace);
            ps.setString(3, payload);
            ps.setTimestamp(4, Timestamp.from(createdAt));
            ps.setTimestamp(5, Timestamp.from(expiresAt));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceUnavailableException("Failed to write key " + key + " to durable cache", e);
        }
    }

    @Override
    public void deleteByKey(String key) {
        executeDelete("DELETE FROM " + table + " WHERE cache_key = ?", key, "key " + key);
    }

    @Override
    public void deleteByNamespace(String namespace) {
        int removed = executeDelete("DELETE FROM " + table + " WHERE namespace = ?", namespace, "namespace " + namespace);
        log.debug("Deleted {} durable entries for namespace {}", removed, namespace);
    }

    @Override
    public void deleteAll() {
        final String sql = "DELETE FROM " + table;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int removed = ps.executeUpdate();
            log.info("Durable cache cleared ({} entries)", removed);
        } catch (SQLException e) {
            throw new PersistenceUnavailableException("Failed to clear durable cache", e);
        }
    }

    @Override
    public int deleteExpired() {
        final String sql = "DELETE FROM " + table + " WHERE expires_at <= ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceUnavailableException("Failed to purge expired durable cache entries", e);
        }
    }

    @Override
    public CacheStats stats() {
        final String sql = "SELECT namespace, COUNT(*), MIN(created_at), MAX(created_at) FROM " + table +
                           " WHERE expires_at > ? GROUP BY namespace";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            try (ResultSet rs = ps.executeQuery()) {
                Map<String, Long> byNamespace = new HashMap<>();
                long total = 0;
                Instant oldest = null;
                Instant newest = null;
                while (rs.next()) {
                    long count = rs.getLong(2);
                    byNamespace.put(rs.getString(1), count);
                    total += count;
                    Instant min = rs.getTimestamp(3).toInstant();
                    Instant max = rs.getTimestamp(4).toInstant();
                    if (oldest == null || min.isBefore(oldest)) oldest = min;
                    if (newest == null || max.isAfter(newest)) newest = max;
                }
                return new CacheStats(total, byNamespace, oldest, newest);
            }
        } catch (SQLException e) {
            throw new PersistenceUnavailableException("Failed to read durable cache statistics", e);
        }
    }

    // Conditional on expiry so a concurrent fresh upsert of the same key survives.
    private void reapExpired(Connection c, String key, Instant now) throws SQLException {
        final String sql = "DELETE FROM " + table + " WHERE cache_key = ? AND (expires_at <= ? OR expires_at <= created_at)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setTimestamp(2, Timestamp.from(now));
            ps.executeUpdate();
        }
        log.debug("Reaped expired durable entry {}", key);
    }

    private int executeDelete(String sql, String param, String what) {
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, param);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceUnavailableException("Failed to delete " + what + " from durable cache", e);
        }
    }
}
