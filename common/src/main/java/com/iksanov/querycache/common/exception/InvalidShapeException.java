package com.iksanov.querycache.common.exception;

/**
 * Thrown when a query shape cannot be canonicalized into a cache key.
 */
public class InvalidShapeException extends InvalidCacheRequestException {
    public InvalidShapeException(String message) {
        super(message);
    }
    public InvalidShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
