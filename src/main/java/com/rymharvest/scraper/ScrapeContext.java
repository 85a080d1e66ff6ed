package com.rymharvest.scraper;

import java.util.Objects;

/**
 * Collaborators shared by a root scraper and every dependency scraper it spawns.
 * Built once by the driver, which also owns the lifecycle of the fetcher and store.
 */
public record ScrapeContext(
    PageFetcherInterface fetcher,
    EntityStoreInterface store,
    boolean verbose,
    DependencyFailurePolicy dependencyFailurePolicy
) {
    public ScrapeContext {
        Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(store, "store");
        if (dependencyFailurePolicy == null) dependencyFailurePolicy = DependencyFailurePolicy.ABORT;
    }

    public static ScrapeContext of(PageFetcherInterface fetcher, EntityStoreInterface store) {
        return new ScrapeContext(fetcher, store, false, DependencyFailurePolicy.ABORT);
    }
}
