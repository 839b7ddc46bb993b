package com.iksanov.querycache.cache.durable;

import com.iksanov.querycache.common.exception.PersistenceUnavailableException;

import java.time.Duration;

/**
 * Persistence-backed tier that survives process restarts.
 * <p>
 * Every method may throw {@link PersistenceUnavailableException} when the backend
 * cannot be reached or rejects the operation.
 */
public interface DurableStore {

    /**
     * Returns the live entry for {@code key}, or {@code null}. An entry whose expiry has
     * passed is reported absent and deleted.
     */
    CacheEntry get(String key);

    /** Atomic upsert of value, namespace and expiry. */
    void put(String key, Object value, String namespace, Duration ttl);

    void deleteByKey(String key);

    void deleteByNamespace(String namespace);

    void deleteAll();

    /**
     * Purges every entry whose expiry has passed.
     *
     * @return number of entries removed
     */
    int deleteExpired();

    CacheStats stats();
}
