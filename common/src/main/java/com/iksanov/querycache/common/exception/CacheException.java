package com.iksanov.querycache.common.exception;

/**
 * Root of the cache exception hierarchy. All cache failures are unchecked.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
