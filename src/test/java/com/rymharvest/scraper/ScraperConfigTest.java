package com.rymharvest.scraper;

import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ScraperConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("SCRAPER_MAX_RETRIES");
        System.clearProperty("SCRAPER_DEPENDENCY_POLICY");
        System.clearProperty("CACHE_TTL_SECONDS");
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        Assumptions.assumeTrue(System.getenv("SCRAPER_MAX_RETRIES") == null);
        Assumptions.assumeTrue(System.getenv("SCRAPER_DEPENDENCY_POLICY") == null);
        Assumptions.assumeTrue(System.getenv("CACHE_TTL_SECONDS") == null);
        System.setProperty("SCRAPER_MAX_RETRIES", "5");
        System.setProperty("SCRAPER_DEPENDENCY_POLICY", "skip");
        System.setProperty("CACHE_TTL_SECONDS", "60");

        ScraperConfig config = ScraperConfig.fromEnvironment();
        assertEquals(5, config.maxRetries());
        assertEquals(DependencyFailurePolicy.SKIP, config.dependencyFailurePolicy());
        assertEquals(Duration.ofSeconds(60), config.cacheTtl());
    }

    @Test
    void testNonNumericValueFallsBack() {
        Assumptions.assumeTrue(System.getenv("SCRAPER_MAX_RETRIES") == null);
        System.setProperty("SCRAPER_MAX_RETRIES", "many");
        assertEquals(3, ScraperConfig.intOrDefault("SCRAPER_MAX_RETRIES", 3));
    }

    @Test
    void testUnknownDependencyPolicyFallsBackToAbort() {
        Assumptions.assumeTrue(System.getenv("SCRAPER_DEPENDENCY_POLICY") == null);
        System.setProperty("SCRAPER_DEPENDENCY_POLICY", "skipp");

        ScraperConfig config = assertDoesNotThrow(ScraperConfig::fromEnvironment);
        assertEquals(DependencyFailurePolicy.ABORT, config.dependencyFailurePolicy());
    }

    @Test
    void testDatabaseAndCacheSelection() {
        ScraperConfig embedded = new ScraperConfig("", "postgres", "postgres", 5432, "pg", "", 6379,
            Duration.ZERO, "out", false, DependencyFailurePolicy.ABORT, 3, 1000);
        assertTrue(embedded.useEmbeddedDatabase());
        assertFalse(embedded.useRedis());

        ScraperConfig external = new ScraperConfig("jdbc:postgresql://db:5432/rym", "rym", "secret", 5432, "pg",
            "redis", 6379, Duration.ZERO, "out", false, DependencyFailurePolicy.ABORT, 3, 1000);
        assertFalse(external.useEmbeddedDatabase());
        assertTrue(external.useRedis());
    }
}
