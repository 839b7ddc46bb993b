package com.iksanov.querycache.cache.durable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A row of the durable tier. {@code payload} is the JSON form of the cached value.
 */
public record CacheEntry(String key, String namespace, String payload, Instant createdAt, Instant expiresAt) {

    public CacheEntry {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key cannot be null or blank");
        if (namespace == null || namespace.isBlank()) throw new IllegalArgumentException("namespace cannot be null or blank");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Duration remainingTtl(Instant now) {
        return Duration.between(now, expiresAt);
    }
}
