package com.rymharvest.scraper;

import java.util.Optional;

/**
 * Interface for the key/value cache used for computed aggregations.
 * <p>
 * Expiry is owned by the implementation's configuration; there is no explicit invalidation.
 * Implementations log and absorb backend failures: a failed read is a miss and a failed write is skipped.
 */
public interface CacheServiceInterface {
    /**
     * Reads a cached object.
     * @param key cache key
     * @param type expected value type
     * @param <T> value type
     * @return the cached value, or empty on a miss
     */
    <T> Optional<T> getObject(String key, Class<T> type);

    /**
     * Stores an object under a key, replacing any previous value.
     * @param key cache key
     * @param value value to cache
     */
    void setObject(String key, Object value);
}
