package com.iksanov.querycache.cache.core;

/**
 * Produces the value for a read-through miss. Whatever it throws reaches the caller unchanged.
 *
 * @param <T> value type
 * @param <E> exception the loader may throw; inferred as {@link RuntimeException} for lambdas that throw nothing checked
 */
@FunctionalInterface
public interface CacheLoader<T, E extends Exception> {
    T load() throws E;
}
