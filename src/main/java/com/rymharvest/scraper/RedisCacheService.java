package com.rymharvest.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed cache for computed aggregations.
 * <p>
 * Values are stored as JSON strings written with Jackson. A positive TTL is applied to every write;
 * a zero or null TTL stores entries without expiry, leaving eviction to the Redis server's policy.
 * Backend failures are logged and treated as a miss or a skipped write.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public class RedisCacheService implements CacheServiceInterface, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private final LettuceConnectionFactory connectionFactory;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisCacheService(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this(null, redisTemplate, objectMapper, ttl);
    }

    private RedisCacheService(LettuceConnectionFactory connectionFactory, StringRedisTemplate redisTemplate,
                              ObjectMapper objectMapper, Duration ttl) {
        this.connectionFactory = connectionFactory;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    /**
     * Opens a Lettuce connection to a standalone Redis server.
     * @param host Redis host
     * @param port Redis port
     * @param ttl expiry applied to every write, or null/zero for none
     * @return connected cache service; close it to release the connection
     */
    public static RedisCacheService connect(String host, int port, Duration ttl) {
        LettuceConnectionFactory factory = new LettuceConnectionFactory(new RedisStandaloneConfiguration(host, port));
        factory.afterPropertiesSet();
        StringRedisTemplate template = new StringRedisTemplate(factory);
        logger.info("Connected Redis aggregation cache at {}:{} (ttl={})", host, port, ttl);
        return new RedisCacheService(factory, template, new ObjectMapper(), ttl);
    }

    public <T> Optional<T> getObject(String key, Class<T> type) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                logger.debug("Cache MISS for key '{}'", key);
                return Optional.empty();
            }
            logger.debug("Cache HIT for key '{}'", key);
            return Optional.of(objectMapper.readValue(json, type));
        } catch (Exception e) {
            logger.warn("Error reading key '{}' from cache: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void setObject(String key, Object value) {
        if (key == null || value == null) {
            logger.warn("Refusing to cache null key or value (key={})", key);
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(value);
            if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                redisTemplate.opsForValue().set(key, json, ttl);
            } else {
                redisTemplate.opsForValue().set(key, json);
            }
            logger.debug("Cached value under key '{}'", key);
        } catch (Exception e) {
            logger.warn("Error caching key '{}': {}", key, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
            logger.info("Redis aggregation cache connection closed.");
        }
    }
}
