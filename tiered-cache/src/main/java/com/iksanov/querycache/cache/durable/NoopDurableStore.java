package com.iksanov.querycache.cache.durable;

import java.time.Duration;

/**
 * Durable tier used when persistence is disabled: stores nothing, never fails.
 */
public final class NoopDurableStore implements DurableStore {

    @Override
    public CacheEntry get(String key) {
        return null;
    }

    @Override
    public void put(String key, Object value, String namespace, Duration ttl) {
    }

    @Override
    public void deleteByKey(String key) {
    }

    @Override
    public void deleteByNamespace(String namespace) {
    }

    @Override
    public void deleteAll() {
    }

    @Override
    public int deleteExpired() {
        return 0;
    }

    @Override
    public CacheStats stats() {
        return CacheStats.empty();
    }
}
