package com.rymharvest.scraper;

/**
 * What a parent scraper does when one of its dependency scrapers fails.
 */
public enum DependencyFailurePolicy {
    /** Propagate the failure; the parent is not persisted. */
    ABORT,
    /** Record an error diagnostic and persist the parent without that relation. */
    SKIP;

    public static DependencyFailurePolicy parse(String value) {
        if (value == null || value.isBlank()) return ABORT;
        return valueOf(value.trim().toUpperCase());
    }
}
