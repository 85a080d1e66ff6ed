package com.rymharvest.scraper;

import java.util.List;
import java.util.Optional;

/**
 * Lifecycle contract for scraping and storing a single entity.
 *
 * @param <E> entity record produced by the scraper
 */
public interface Scraper<E> {
    /**
     * Runs the lifecycle: lookup, fetch, extract, resolve dependencies, persist.
     * Calling it again after completion returns the same entity without any I/O.
     * @return the stored entity, either found or newly persisted
     * @throws FetchException if this scraper's page, or a dependency's page under
     * {@link DependencyFailurePolicy#ABORT}, cannot be fetched
     */
    E scrape() throws FetchException;

    /**
     * Returns the entity this scraper resolved to: the completed result, or a store lookup by natural key
     * when the scraper has not completed.
     */
    Optional<E> getEntity();

    /**
     * Logs and returns a summary of the run.
     */
    String printInfo();

    List<ScrapeDiagnostic> getResults();

    ScrapeState getState();

    List<ScrapeState> getStateHistory();

    Integer getDatabaseId();

    boolean isDataReadFromDB();

    String getUrl();
}
