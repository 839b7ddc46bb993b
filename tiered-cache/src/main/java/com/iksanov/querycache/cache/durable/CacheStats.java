package com.iksanov.querycache.cache.durable;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of live durable-tier contents.
 * {@code oldestEntry} and {@code newestEntry} are write timestamps and are {@code null} when empty.
 */
public record CacheStats(long totalEntries, Map<String, Long> entriesByNamespace, Instant oldestEntry, Instant newestEntry) {

    public CacheStats {
        entriesByNamespace = Map.copyOf(entriesByNamespace);
    }

    public static CacheStats empty() {
        return new CacheStats(0, Map.of(), null, null);
    }
}
