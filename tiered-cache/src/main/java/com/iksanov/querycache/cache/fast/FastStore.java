package com.iksanov.querycache.cache.fast;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * In-process tier. Authoritative for the common read path, never for restarts.
 * Implementations must make each operation individually atomic under concurrent use.
 */
public interface FastStore {

    /** Returns the live value for {@code key}, or {@code null} when absent or expired. */
    Object get(String key);

    /** Stores or fully replaces the value and TTL for {@code key}. */
    void set(String key, Object value, Duration ttl);

    void delete(String key);

    void deleteWhere(Predicate<String> keyPredicate);

    void clear();

    int size();
}
