package com.rymharvest.aggregation;

import com.rymharvest.scraper.CacheServiceInterface;
import com.rymharvest.scraper.CsvServiceInterface;
import com.rymharvest.scraper.EntityStoreInterface;

import java.util.Objects;

/**
 * Collaborators shared by every aggregator of one export run.
 */
public record AggregationContext(
    CacheServiceInterface cache,
    EntityStoreInterface store,
    CsvServiceInterface csvService
) {
    public AggregationContext {
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(csvService, "csvService");
    }
}
