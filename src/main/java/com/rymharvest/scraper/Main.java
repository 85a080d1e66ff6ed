package com.rymharvest.scraper;

import com.rymharvest.aggregation.AggregationContext;
import com.rymharvest.aggregation.AggregationExporter;
import com.rymharvest.aggregation.AggregationType;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Main entry point for the Rate Your Music crawler.
 * <p>
 * Modes (first argument):
 * <ul>
 *   <li>{@code db}: start the embedded PostgreSQL and keep it running until Enter is pressed;</li>
 *   <li>{@code scrape artist|album <url>...}: scrape root entities, each with its dependencies;</li>
 *   <li>{@code export artist|album|track [raw] [fileName]}: aggregate every stored entity of a type and
 *   write the batch to CSV.</li>
 * </ul>
 * Settings come from {@link ScraperConfig}.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final long RETRY_BASE_DELAY_MS = 2_000;

    /**
     * Creates a PostgresService for the configured or embedded database and ensures tables exist.
     */
    private static PostgresService createPostgresService(ScraperConfig config, EmbeddedPostgres postgres) {
        String dbUrl = postgres == null
            ? config.dbUrl()
            : String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
        PostgresService postgresService = new PostgresService(dbUrl, config.dbUser(), config.dbPass());
        postgresService.createTables();
        return postgresService;
    }

    /**
     * Scrapes each root URL with a fresh scraper per attempt. A root that keeps failing is logged and skipped;
     * other roots are unaffected.
     * @return number of roots stored
     */
    static <E> int scrapeRoots(List<String> urls, Function<String, Scraper<E>> factory, int maxRetries, long retryDelayMs) {
        int stored = 0;
        for (String url : urls) {
            Scraper<E> completed = Utils.retry(() -> {
                Scraper<E> scraper = factory.apply(url);
                scraper.scrape();
                return scraper;
            }, maxRetries, retryDelayMs, "scrape " + url);
            if (completed == null) {
                logger.error("Could not scrape {}", url);
                continue;
            }
            completed.printInfo();
            completed.getResults().stream()
                .filter(d -> d.status() != ScrapeDiagnostic.Status.SUCCESS)
                .forEach(d -> logger.info("{}", d));
            stored++;
        }
        logger.info("Scraping complete. Stored {} of {} root entities.", stored, urls.size());
        return stored;
    }

    private static void runScrape(String[] args, ScraperConfig config, EntityStoreInterface store) {
        if (args.length < 3) {
            logger.error("Usage: scrape artist|album <url>...");
            return;
        }
        String kind = args[1].trim().toLowerCase();
        List<String> urls = Arrays.asList(args).subList(2, args.length);
        try (PlaywrightPageFetcher fetcher = new PlaywrightPageFetcher(config.fetchTimeoutMs())) {
            ScrapeContext context = new ScrapeContext(fetcher, store, config.verbose(), config.dependencyFailurePolicy());
            switch (kind) {
                case "artist" -> scrapeRoots(urls, url -> new ArtistScraper(url, context), config.maxRetries(), RETRY_BASE_DELAY_MS);
                case "album" -> scrapeRoots(urls, url -> new AlbumScraper(url, context), config.maxRetries(), RETRY_BASE_DELAY_MS);
                default -> logger.error("Unknown scrape target '{}'. Use artist or album.", kind);
            }
        }
    }

    private static void runExport(String[] args, ScraperConfig config, EntityStoreInterface store) throws IOException {
        if (args.length < 2) {
            logger.error("Usage: export artist|album|track [raw] [fileName]");
            return;
        }
        AggregationType type = AggregationType.fromKey(args[1].trim());
        boolean normalized = true;
        String fileName = "data";
        for (int i = 2; i < args.length; i++) {
            if (args[i].equalsIgnoreCase("raw")) normalized = false;
            else fileName = Utils.sanitizeFilename(args[i]);
        }
        CacheServiceInterface cache = null;
        try {
            cache = config.useRedis()
                ? RedisCacheService.connect(config.redisHost(), config.redisPort(), config.cacheTtl())
                : new LocalCacheService(10_000, config.cacheTtl());
            AggregationExporter exporter = new AggregationExporter(new AggregationContext(cache, store, new CsvService()));
            int rows = exporter.export(type, normalized, fileName, config.exportDir());
            logger.info("Exported {} {} rows ({}).", rows, type.key(), normalized ? "normalized" : "raw");
        } finally {
            if (cache instanceof RedisCacheService redis) redis.close();
        }
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase() : "";
        if (mode.isBlank()) {
            System.out.println("Usage:\n  db\n  scrape artist|album <url>...\n  export artist|album|track [raw] [fileName]");
            return;
        }
        ScraperConfig config = ScraperConfig.fromEnvironment();
        EmbeddedPostgres postgres = null;
        try {
            if (config.useEmbeddedDatabase() || mode.equals("db")) {
                postgres = PostgresService.startEmbedded(config.embeddedPgDataDir(), config.embeddedPgPort());
            }
            PostgresService store = createPostgresService(config, postgres);

            switch (mode) {
                case "db" -> {
                    System.out.println("Embedded Postgres started.");
                    System.out.println("JDBC URL: " + String.format("jdbc:postgresql://localhost:%d/postgres", config.embeddedPgPort()));
                    System.out.println("Data directory: " + config.embeddedPgDataDir());
                    System.out.println("Press Enter to stop the embedded DB and exit.");
                    try {
                        System.in.read();
                    } catch (IOException e) {
                        logger.warn("Failed to read from stdin: {}", e.getMessage());
                    }
                }
                case "scrape" -> runScrape(args, config, store);
                case "export" -> runExport(args, config, store);
                default -> logger.error("Unknown mode '{}'. Use db, scrape or export.", mode);
            }
        } catch (Exception e) {
            logger.error("Run failed: {}", e.getMessage(), e);
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
    }
}
