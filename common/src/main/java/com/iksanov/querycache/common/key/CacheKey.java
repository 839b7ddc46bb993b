package com.iksanov.querycache.common.key;

/**
 * Derived cache key: {@code namespace:sha256(canonical shape)}.
 */
public record CacheKey(String namespace, String digest) {

    public static final char SEPARATOR = ':';

    public CacheKey {
        KeyDeriver.requireValidNamespace(namespace);
        if (digest == null || digest.length() != KeyDeriver.DIGEST_HEX_LENGTH) {
            throw new IllegalArgumentException("digest must be " + KeyDeriver.DIGEST_HEX_LENGTH + " hex chars");
        }
    }

    public String value() {
        return namespace + SEPARATOR + digest;
    }

    public static String prefix(String namespace) {
        return KeyDeriver.requireValidNamespace(namespace) + SEPARATOR;
    }

    @Override
    public String toString() {
        return value();
    }
}
