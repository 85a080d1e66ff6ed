package com.rymharvest.scraper;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process Caffeine cache used when no Redis server is configured.
 * Entries live until evicted by size or, when a TTL is given, by age.
 */
public class LocalCacheService implements CacheServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(LocalCacheService.class);
    private static final long DEFAULT_MAX_SIZE = 10_000;

    private final Cache<String, Object> cache;

    public LocalCacheService() {
        this(DEFAULT_MAX_SIZE, null);
    }

    public LocalCacheService(long maxSize, Duration ttl) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder().maximumSize(maxSize);
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) builder.expireAfterWrite(ttl);
        this.cache = builder.build();
    }

    public <T> Optional<T> getObject(String key, Class<T> type) {
        Object value = cache.getIfPresent(key);
        if (value == null) {
            logger.debug("Cache MISS for key '{}'", key);
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            logger.warn("Cached value for key '{}' is a {}, expected {}", key, value.getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        logger.debug("Cache HIT for key '{}'", key);
        return Optional.of(type.cast(value));
    }

    public void setObject(String key, Object value) {
        if (key == null || value == null) {
            logger.warn("Refusing to cache null key or value (key={})", key);
            return;
        }
        cache.put(key, value);
    }
}
