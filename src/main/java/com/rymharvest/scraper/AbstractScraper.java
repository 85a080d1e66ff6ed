package com.rymharvest.scraper;

import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Shared lifecycle for every scraper.
 * <p>
 * Workflow of {@link #scrape()}:
 * <ul>
 *   <li>Looks the entity up by natural key; a hit completes the run without touching the network.</li>
 *   <li>Fetches the page through the context's {@link PageFetcherInterface}. A failure here propagates.</li>
 *   <li>Runs the subclass's extraction steps. Each step is best-effort: a missing or malformed field
 *   keeps its default and is recorded as a {@link ScrapeDiagnostic.Status#DEGRADED} diagnostic.</li>
 *   <li>Runs the dependency scrapers created during extraction, one after another in discovery order,
 *   and appends their diagnostics to this scraper's.</li>
 *   <li>Persists the entity with relations taken from the completed dependencies.</li>
 * </ul>
 * States only move forward (see {@link ScrapeState}). A run that failed leaves the instance unusable;
 * retrying means constructing a new scraper, which starts with the cheap lookup again.
 *
 * @param <E> entity record produced by the scraper
 * @author RYM Harvest Team
 * @since 1.0
 */
public abstract class AbstractScraper<E> implements Scraper<E> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractScraper.class);

    protected final String url;
    protected final String kind;
    protected final ScrapeContext context;
    protected final boolean verbose;

    /** Fetched page; only held between fetch and persistence. */
    protected Document document;

    private final List<ScrapeDiagnostic> results = new ArrayList<>();
    private final List<ScrapeState> stateHistory = new ArrayList<>();
    private final List<Scraper<?>> failedDependencies = new ArrayList<>();
    private ScrapeState state = ScrapeState.CREATED;
    private Integer databaseId;
    private boolean dataReadFromDB;
    private boolean failed;
    private E entity;

    protected AbstractScraper(String url, String kind, ScrapeContext context) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException(kind + " scraper requires a URL");
        }
        this.url = url;
        this.kind = kind;
        this.context = context;
        this.verbose = context.verbose();
        this.stateHistory.add(ScrapeState.CREATED);
    }

    @Override
    public final E scrape() throws FetchException {
        if (state == ScrapeState.COMPLETE) return entity;
        if (failed) {
            throw new IllegalStateException(kind + " scraper for " + url + " already failed; create a new scraper to retry");
        }
        try {
            Optional<E> found = lookup();
            advanceTo(ScrapeState.RESOLVED);
            if (found.isPresent()) {
                entity = found.get();
                databaseId = idOf(entity);
                dataReadFromDB = true;
                onFoundInDatabase(entity);
                record(ScrapeDiagnostic.Status.SUCCESS, "Found in database (id=" + databaseId + ")");
                advanceTo(ScrapeState.COMPLETE);
                return entity;
            }

            document = requestScrape();
            advanceTo(ScrapeState.FETCHED);

            extractInfo();
            advanceTo(ScrapeState.EXTRACTED);

            scrapeDependencies();
            advanceTo(ScrapeState.DEPENDENCIES_RESOLVED);

            E saved = saveToDB();
            entity = saved;
            databaseId = idOf(saved);
            advanceTo(ScrapeState.PERSISTED);
            record(ScrapeDiagnostic.Status.SUCCESS, "Scraped and saved (id=" + databaseId + ")");
            document = null;
            advanceTo(ScrapeState.COMPLETE);
            return saved;
        } catch (FetchException | RuntimeException e) {
            failed = true;
            record(ScrapeDiagnostic.Status.ERROR, "Scrape failed in state " + state + ": " + e.getMessage());
            throw e;
        }
    }

    @Override
    public Optional<E> getEntity() {
        if (state == ScrapeState.COMPLETE) return Optional.ofNullable(entity);
        return lookup();
    }

    // --- Lifecycle steps ---

    /**
     * Looks the entity up in the store by its natural key.
     */
    protected abstract Optional<E> lookup();

    /**
     * Fetches the page for {@link #url}. Scrapers whose entity needs no page override this.
     */
    protected Document requestScrape() throws FetchException {
        logger.debug("Requesting {} page {}", kind, url);
        return context.fetcher().fetch(url);
    }

    /**
     * Populates fields from {@link #document} and creates (without running) dependency scrapers.
     * Implementations wrap each field in {@link #runExtraction(String, Runnable)}.
     */
    protected abstract void extractInfo();

    /**
     * Dependency scrapers discovered during extraction, in discovery order.
     */
    protected List<? extends Scraper<?>> dependencies() {
        return List.of();
    }

    /**
     * Runs every dependency scraper sequentially and merges their diagnostics into {@link #getResults()}.
     */
    protected void scrapeDependencies() throws FetchException {
        for (Scraper<?> dependency : dependencies()) {
            try {
                dependency.scrape();
            } catch (FetchException | RuntimeException e) {
                results.addAll(dependency.getResults());
                if (context.dependencyFailurePolicy() == DependencyFailurePolicy.ABORT) throw e;
                failedDependencies.add(dependency);
                record(ScrapeDiagnostic.Status.ERROR, "Skipping dependency " + dependency.getUrl() + ": " + e.getMessage());
                continue;
            }
            results.addAll(dependency.getResults());
        }
    }

    /**
     * Builds the entity with its relations and writes it to the store.
     * @return the stored entity with its id
     */
    protected abstract E saveToDB();

    protected abstract Integer idOf(E stored);

    /**
     * Copies display fields from a stored entity after a lookup hit.
     */
    protected void onFoundInDatabase(E stored) {
    }

    /**
     * Field summary of a fresh scrape, one line per field.
     */
    protected abstract List<String> describeScrape();

    /**
     * Short label of the entity, used in the "found in database" summary.
     */
    protected abstract String label();

    // --- Relations ---

    /**
     * Collects the entities of completed dependency scrapers, preserving order.
     * Dependencies skipped under {@link DependencyFailurePolicy#SKIP} are left out.
     */
    protected <T> List<T> completedEntities(List<? extends Scraper<T>> scrapers) {
        List<T> entities = new ArrayList<>();
        for (Scraper<T> scraper : scrapers) {
            if (failedDependencies.contains(scraper)) continue;
            T related = scraper.getEntity()
                .orElseThrow(() -> new PersistenceException("Dependency " + scraper.getUrl() + " has no stored entity"));
            entities.add(related);
        }
        return entities;
    }

    /**
     * Number of scrapers in the list that were not skipped as failed dependencies.
     */
    protected int usableDependencyCount(List<? extends Scraper<?>> scrapers) {
        int count = 0;
        for (Scraper<?> scraper : scrapers) {
            if (!failedDependencies.contains(scraper)) count++;
        }
        return count;
    }

    // --- Extraction helpers ---

    /**
     * Runs one extraction step. A runtime failure is recorded as a degradation and does not abort extraction.
     */
    protected final void runExtraction(String fieldName, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            degrade(fieldName, "extraction failed (" + e.getMessage() + ")", "default");
        }
    }

    /**
     * Reads the first non-blank text for a registry field, or records a degradation and returns the default.
     */
    protected String extractString(String fieldName, String defaultVal) {
        Optional<String> text = HtmlExtractor.firstText(document, MetadataFieldRegistry.getField(fieldName));
        if (text.isPresent()) return text.get();
        degrade(fieldName, "not found", defaultVal);
        return defaultVal;
    }

    /**
     * Reads a registry field and parses a number out of it, or records a degradation and returns the default.
     */
    protected int extractNumber(String fieldName, int defaultVal) {
        return extractNumber(fieldName, defaultVal, HtmlExtractor::parseNumber);
    }

    protected int extractNumber(String fieldName, int defaultVal, Function<String, OptionalInt> parser) {
        Optional<String> text = HtmlExtractor.firstText(document, MetadataFieldRegistry.getField(fieldName));
        if (text.isEmpty()) {
            degrade(fieldName, "not found", defaultVal);
            return defaultVal;
        }
        OptionalInt parsed = parser.apply(text.get());
        if (parsed.isEmpty()) {
            degrade(fieldName, "could not parse '" + text.get() + "'", defaultVal);
            return defaultVal;
        }
        return parsed.getAsInt();
    }

    protected final void degrade(String fieldName, String reason, Object defaultVal) {
        record(ScrapeDiagnostic.Status.DEGRADED, fieldName + " " + reason + ", using default " + defaultVal);
    }

    protected final void record(ScrapeDiagnostic.Status status, String message) {
        ScrapeDiagnostic diagnostic = new ScrapeDiagnostic(status, kind + " " + url, message);
        results.add(diagnostic);
        if (verbose) {
            logger.info("{}", diagnostic);
        } else {
            logger.debug("{}", diagnostic);
        }
    }

    // --- State ---

    private void advanceTo(ScrapeState next) {
        if (state.isAfter(next)) {
            throw new IllegalStateException(kind + " scraper cannot move from " + state + " back to " + next);
        }
        state = next;
        stateHistory.add(next);
    }

    // --- Reporting ---

    @Override
    public String printInfo() {
        List<String> lines = new ArrayList<>();
        if (state != ScrapeState.COMPLETE) {
            lines.add(kind + " " + url + " not scraped (state " + state + ")");
        } else if (dataReadFromDB) {
            lines.add("Found " + kind + " " + label() + " in database");
            lines.add("ID: " + databaseId);
        } else {
            lines.addAll(describeScrape());
        }
        lines.forEach(line -> logger.info("{}", line));
        return String.join("\n", lines);
    }

    @Override
    public List<ScrapeDiagnostic> getResults() {
        return Collections.unmodifiableList(results);
    }

    @Override
    public ScrapeState getState() {
        return state;
    }

    @Override
    public List<ScrapeState> getStateHistory() {
        return Collections.unmodifiableList(stateHistory);
    }

    @Override
    public Integer getDatabaseId() {
        return databaseId;
    }

    @Override
    public boolean isDataReadFromDB() {
        return dataReadFromDB;
    }

    @Override
    public String getUrl() {
        return url;
    }
}
