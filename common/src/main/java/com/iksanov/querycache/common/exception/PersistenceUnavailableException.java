package com.iksanov.querycache.common.exception;

/**
 * Signals that the durable tier could not serve a read or accept a write.
 * The coordinator logs and absorbs it; callers of the cache never see it.
 */
public class PersistenceUnavailableException extends StorageAccessException {
    public PersistenceUnavailableException(String message) {
        super(message);
    }
    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
