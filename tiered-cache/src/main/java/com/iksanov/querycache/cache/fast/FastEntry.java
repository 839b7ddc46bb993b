package com.iksanov.querycache.cache.fast;

final class FastEntry {
    final Object value;
    final long expireAtMillis;

    FastEntry(Object value, long expireAtMillis) {
        this.value = value;
        this.expireAtMillis = expireAtMillis;
    }

    boolean isExpired(long nowMillis) {
        return nowMillis >= expireAtMillis;
    }
}
