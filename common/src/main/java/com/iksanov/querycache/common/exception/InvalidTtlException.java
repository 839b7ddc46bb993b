package com.iksanov.querycache.common.exception;

/**
 * Thrown for a missing, zero or negative time-to-live.
 */
public class InvalidTtlException extends InvalidCacheRequestException {
    public InvalidTtlException(String message) {
        super(message);
    }
    public InvalidTtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
