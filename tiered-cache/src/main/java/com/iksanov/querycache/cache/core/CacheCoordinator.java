package com.iksanov.querycache.cache.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.iksanov.querycache.cache.durable.CacheEntry;
import com.iksanov.querycache.cache.durable.CacheStats;
import com.iksanov.querycache.cache.durable.DurableStore;
import com.iksanov.querycache.cache.fast.FastStore;
import com.iksanov.querycache.cache.metrics.CacheMetrics;
import com.iksanov.querycache.common.codec.JsonValueCodec;
import com.iksanov.querycache.common.exception.InvalidCacheRequestException;
import com.iksanov.querycache.common.exception.PersistenceUnavailableException;
import com.iksanov.querycache.common.exception.SerializationException;
import com.iksanov.querycache.common.key.CacheKey;
import com.iksanov.querycache.common.key.KeyDeriver;
import com.iksanov.querycache.common.util.TtlUtils;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-tier cache coordinator: read-through lookup, write-through population and
 * namespace invalidation across a {@link FastStore} and a {@link DurableStore}.
 *
 * <p>Reads:
 * <ul>
 *   <li>fast tier hit returns immediately</li>
 *   <li>durable hit with time left is promoted to the fast tier with the remaining TTL,
 *       so both tiers expire at the same instant</li>
 *   <li>durable hit already past expiry is deleted and reported absent</li>
 * </ul>
 *
 * <p>The durable tier is an optimization for warm restarts. Its failures are logged and
 * counted, never thrown: a failed read is a miss and a failed write leaves the value in
 * the fast tier only. Invalid namespaces, shapes and TTLs are thrown before any store is touched.
 *
 * <p>Concurrent misses for the same key are not collapsed; each caller of
 * {@link #readThrough} may run its loader.
 */
public class CacheCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CacheCoordinator.class);
    private final KeyDeriver keyDeriver;
    private final FastStore fastStore;
    private final DurableStore durableStore;
    private final JsonValueCodec codec;
    private final Clock clock;
    private final Duration defaultTtl;
    private final CacheMetrics metrics;

    public CacheCoordinator(FastStore fastStore, DurableStore durableStore, Duration defaultTtl) {
        this(new KeyDeriver(), fastStore, durableStore, new JsonValueCodec(), Clock.systemUTC(), defaultTtl, new CacheMetrics());
    }

    public CacheCoordinator(KeyDeriver keyDeriver, FastStore fastStore, DurableStore durableStore, JsonValueCodec codec,
                            Clock clock, Duration defaultTtl, CacheMetrics metrics) {
        this.keyDeriver = Objects.requireNonNull(keyDeriver, "keyDeriver cannot be null");
        this.fastStore = Objects.requireNonNull(fastStore, "fastStore cannot be null");
        this.durableStore = Objects.requireNonNull(durableStore, "durableStore cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.defaultTtl = TtlUtils.requirePositive(defaultTtl);
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    public <T> Optional<T> get(String namespace, Object shape, Class<T> type) {
        return lookup(namespace, shape, codec.typeOf(type));
    }

    public <T> Optional<T> get(String namespace, Object shape, TypeReference<T> type) {
        return lookup(namespace, shape, codec.typeOf(type));
    }

    public void put(String namespace, Object shape, Object value) {
        put(namespace, shape, value, defaultTtl);
    }

    public void put(String namespace, Object shape, Object value, Duration ttl) {
        TtlUtils.requirePositive(ttl);
        if (value == null) throw new InvalidCacheRequestException("value cannot be null");
        CacheKey key = keyDeriver.derive(namespace, shape);

        Timer.Sample sample = metrics.startPutTimer();
        try {
            fastStore.set(key.value(), value, ttl);
            try {
                durableStore.put(key.value(), value, namespace, ttl);
            } catch (PersistenceUnavailableException | SerializationException e) {
                metrics.recordDurableFailure();
                log.warn("Durable write failed for {}, value kept in fast tier only: {}", key, e.getMessage());
            }
        } finally {
            metrics.stopPutTimer(sample);
        }
    }

    public <T, E extends Exception> T readThrough(String namespace, Object shape, Class<T> type,
                                                  CacheLoader<? extends T, E> loader) throws E {
        return readThrough(namespace, shape, defaultTtl, type, loader);
    }

    public <T, E extends Exception> T readThrough(String namespace, Object shape, Duration ttl, Class<T> type,
                                                  CacheLoader<? extends T, E> loader) throws E {
        return loadThrough(namespace, shape, ttl, codec.typeOf(type), loader);
    }

    public <T, E extends Exception> T readThrough(String namespace, Object shape, Duration ttl, TypeReference<T> type,
                                                  CacheLoader<? extends T, E> loader) throws E {
        return loadThrough(namespace, shape, ttl, codec.typeOf(type), loader);
    }

    public void invalidate(String namespace) {
        String prefix = CacheKey.prefix(namespace);
        metrics.recordInvalidation();

        RuntimeException fastFailure = null;
        try {
            fastStore.deleteWhere(key -> key.startsWith(prefix));
        } catch (RuntimeException e) {
            fastFailure = e;
        }
        try {
            durableStore.deleteByNamespace(namespace);
        } catch (PersistenceUnavailableException e) {
            metrics.recordDurableFailure();
            log.warn("Durable invalidation failed for namespace {}: {}", namespace, e.getMessage());
        }
        if (fastFailure != null) throw fastFailure;
        log.debug("Invalidated namespace {}", namespace);
    }

    public void invalidateAll() {
        metrics.recordInvalidation();

        RuntimeException fastFailure = null;
        try {
            fastStore.clear();
        } catch (RuntimeException e) {
            fastFailure = e;
        }
        try {
            durableStore.deleteAll();
        } catch (PersistenceUnavailableException e) {
            metrics.recordDurableFailure();
            log.warn("Durable clear failed: {}", e.getMessage());
        }
        if (fastFailure != null) throw fastFailure;
        log.info("Invalidated all cache entries");
    }

    /**
     * Live durable-tier statistics, or {@link CacheStats#empty()} when the durable tier is unavailable.
     */
    public CacheStats stats() {
        try {
            return durableStore.stats();
        } catch (PersistenceUnavailableException e) {
            metrics.recordDurableFailure();
            log.warn("Failed to read cache statistics: {}", e.getMessage());
            return CacheStats.empty();
        }
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public CacheMetrics metrics() {
        return metrics;
    }

    private <T, E extends Exception> T loadThrough(String namespace, Object shape, Duration ttl, JavaType type,
                                                   CacheLoader<? extends T, E> loader) throws E {
        TtlUtils.requirePositive(ttl);
        Objects.requireNonNull(loader, "loader");

        Optional<T> cached = lookup(namespace, shape, type);
        if (cached.isPresent()) return cached.get();

        metrics.recordCompute();
        T value = loader.load();
        if (value == null) {
            log.debug("Loader returned null for namespace {}, not caching", namespace);
            return null;
        }
        put(namespace, shape, value, ttl);
        return value;
    }

    private <T> Optional<T> lookup(String namespace, Object shape, JavaType type) {
        CacheKey key = keyDeriver.derive(namespace, shape);

        Timer.Sample sample = metrics.startGetTimer();
        try {
            Object cached = fastStore.get(key.value());
            if (cached != null) {
                T value;
                try {
                    value = codec.adapt(cached, type);
                } catch (SerializationException e) {
                    metrics.recordMiss();
                    log.warn("Fast tier value for {} is not readable as {}, treating as miss: {}", key, type, e.getMessage());
                    return Optional.empty();
                }
                metrics.recordFastHit();
                log.trace("Fast tier hit for {}", key);
                return Optional.of(value);
            }
            return Optional.ofNullable(loadFromDurable(key, type));
        } finally {
            metrics.stopGetTimer(sample);
        }
    }

    private <T> T loadFromDurable(CacheKey key, JavaType type) {
        CacheEntry entry;
        try {
            entry = durableStore.get(key.value());
        } catch (PersistenceUnavailableException e) {
            metrics.recordDurableFailure();
            metrics.recordMiss();
            log.warn("Durable lookup failed for {}, treating as miss: {}", key, e.getMessage());
            return null;
        }

        if (entry == null) {
            metrics.recordMiss();
            log.debug("Cache miss for {}", key);
            return null;
        }

        Instant now = clock.instant();
        Duration remaining = entry.remainingTtl(now);
        if (remaining.isZero() || remaining.isNegative()) {
            metrics.recordMiss();
            evictStale(key);
            return null;
        }

        T value;
        try {
            value = codec.decode(entry.payload(), type);
        } catch (SerializationException e) {
            metrics.recordMiss();
            log.warn("Durable payload for {} could not be decoded as {}, treating as miss: {}", key, type, e.getMessage());
            return null;
        }
        if (value == null) {
            metrics.recordMiss();
            return null;
        }

        fastStore.set(key.value(), value, remaining);
        metrics.recordDurableHit();
        log.debug("Durable hit for {}, promoted with {}ms remaining", key, remaining.toMillis());
        return value;
    }

    private void evictStale(CacheKey key) {
        try {
            durableStore.deleteByKey(key.value());
            log.debug("Deleted stale durable entry {}", key);
        } catch (PersistenceUnavailableException e) {
            metrics.recordDurableFailure();
            log.warn("Failed to delete stale durable entry {}: {}", key, e.getMessage());
        }
    }
}
