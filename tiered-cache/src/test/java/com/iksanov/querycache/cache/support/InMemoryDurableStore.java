package com.iksanov.querycache.cache.support;

import com.iksanov.querycache.cache.durable.CacheEntry;
import com.iksanov.querycache.cache.durable.CacheStats;
import com.iksanov.querycache.cache.durable.DurableStore;
import com.iksanov.querycache.common.codec.JsonValueCodec;
import com.iksanov.querycache.common.exception.PersistenceUnavailableException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed DurableStore for tests. Counts calls and can be switched to fail every operation.
 * Entries survive as long as the instance does, which stands in for a process restart.
 */
public final class InMemoryDurableStore implements DurableStore {

    private final ConcurrentMap<String, CacheEntry> rows = new ConcurrentHashMap<>();
    private final JsonValueCodec codec = new JsonValueCodec();
    private final Clock clock;
    private final AtomicInteger getCalls = new AtomicInteger();
    private final AtomicInteger putCalls = new AtomicInteger();
    private volatile boolean failing = false;

    public InMemoryDurableStore(Clock clock) {
        this.clock = clock;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int getCalls() {
        return getCalls.get();
    }

    public int putCalls() {
        return putCalls.get();
    }

    /** Physical row lookup, bypassing expiry checks. */
    public CacheEntry raw(String key) {
        return rows.get(key);
    }

    public void putRaw(CacheEntry entry) {
        rows.put(entry.key(), entry);
    }

    public int rowCount() {
        return rows.size();
    }

    @Override
    public CacheEntry get(String key) {
        getCalls.incrementAndGet();
        checkAvailable();
        CacheEntry entry = rows.get(key);
        if (entry == null) return null;
        if (entry.isExpired(clock.instant())) {
            rows.remove(key, entry);
            return null;
        }
        return entry;
    }

    @Override
    public void put(String key, Object value, String namespace, Duration ttl) {
        putCalls.incrementAndGet();
        checkAvailable();
        Instant now = clock.instant();
        rows.put(key, new CacheEntry(key, namespace, codec.encode(value), now, now.plus(ttl)));
    }

    @Override
    public void deleteByKey(String key) {
        checkAvailable();
        rows.remove(key);
    }

    @Override
    public void deleteByNamespace(String namespace) {
        checkAvailable();
        rows.values().removeIf(entry -> entry.namespace().equals(namespace));
    }

    @Override
    public void deleteAll() {
        checkAvailable();
        rows.clear();
    }

    @Override
    public int deleteExpired() {
        checkAvailable();
        Instant now = clock.instant();
        int before = rows.size();
        rows.values().removeIf(entry -> entry.isExpired(now));
        return before - rows.size();
    }

    @Override
    public CacheStats stats() {
        checkAvailable();
        Instant now = clock.instant();
        Map<String, Long> byNamespace = new HashMap<>();
        Instant oldest = null;
        Instant newest = null;
        for (CacheEntry entry : rows.values()) {
            if (entry.isExpired(now)) continue;
            byNamespace.merge(entry.namespace(), 1L, Long::sum);
            if (oldest == null || entry.createdAt().isBefore(oldest)) oldest = entry.createdAt();
            if (newest == null || entry.createdAt().isAfter(newest)) newest = entry.createdAt();
        }
        long total = byNamespace.values().stream().mapToLong(Long::longValue).sum();
        return new CacheStats(total, byNamespace, oldest, newest);
    }

    private void checkAvailable() {
        if (failing) throw new PersistenceUnavailableException("durable store offline");
    }
}
