package com.rymharvest.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runtime settings, read from environment variables with Java system properties as fallback.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code DB_URL}, {@code DB_USER}, {@code DB_PASS}: external PostgreSQL; when {@code DB_URL} is blank an
 *   embedded instance is started on {@code EMBEDDED_PG_PORT} with data under {@code EMBEDDED_PG_DATA_DIR}.</li>
 *   <li>{@code REDIS_HOST}, {@code REDIS_PORT}: aggregation cache; when {@code REDIS_HOST} is blank an in-process
 *   cache is used. {@code CACHE_TTL_SECONDS} of 0 means entries do not expire.</li>
 *   <li>{@code EXPORT_DIR}: base directory for CSV exports.</li>
 *   <li>{@code SCRAPER_VERBOSE}, {@code SCRAPER_DEPENDENCY_POLICY} (ABORT or SKIP), {@code SCRAPER_MAX_RETRIES},
 *   {@code FETCH_TIMEOUT_MS}.</li>
 * </ul>
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public record ScraperConfig(
    String dbUrl,
    String dbUser,
    String dbPass,
    int embeddedPgPort,
    String embeddedPgDataDir,
    String redisHost,
    int redisPort,
    Duration cacheTtl,
    String exportDir,
    boolean verbose,
    DependencyFailurePolicy dependencyFailurePolicy,
    int maxRetries,
    int fetchTimeoutMs
) {
    private static final Logger logger = LoggerFactory.getLogger(ScraperConfig.class);

    public static ScraperConfig fromEnvironment() {
        return new ScraperConfig(
            envOrProp("DB_URL", ""),
            envOrProp("DB_USER", "postgres"),
            envOrProp("DB_PASS", "postgres"),
            intOrDefault("EMBEDDED_PG_PORT", 5432),
            envOrProp("EMBEDDED_PG_DATA_DIR", "scraped-data/pgdata"),
            envOrProp("REDIS_HOST", ""),
            intOrDefault("REDIS_PORT", 6379),
            Duration.ofSeconds(intOrDefault("CACHE_TTL_SECONDS", 0)),
            envOrProp("EXPORT_DIR", "./resources/data"),
            Boolean.parseBoolean(envOrProp("SCRAPER_VERBOSE", "false")),
            policyOrDefault("SCRAPER_DEPENDENCY_POLICY", DependencyFailurePolicy.ABORT),
            intOrDefault("SCRAPER_MAX_RETRIES", 3),
            intOrDefault("FETCH_TIMEOUT_MS", 30_000)
        );
    }

    public boolean useEmbeddedDatabase() {
        return dbUrl == null || dbUrl.isBlank();
    }

    public boolean useRedis() {
        return redisHost != null && !redisHost.isBlank();
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }

    static int intOrDefault(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}='{}', using {}", key, raw, defaultVal);
            return defaultVal;
        }
    }

    static DependencyFailurePolicy policyOrDefault(String key, DependencyFailurePolicy defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return DependencyFailurePolicy.parse(raw);
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring unknown {}='{}', using {}", key, raw, defaultVal);
            return defaultVal;
        }
    }
}
