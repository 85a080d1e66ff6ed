package com.rymharvest.scraper;

/**
 * Lifecycle states of a scraper, in the only order they may be visited.
 * A lookup hit jumps from {@link #RESOLVED} straight to {@link #COMPLETE}.
 */
public enum ScrapeState {
    CREATED,
    RESOLVED,
    FETCHED,
    EXTRACTED,
    DEPENDENCIES_RESOLVED,
    PERSISTED,
    COMPLETE;

    public boolean isAfter(ScrapeState other) {
        return ordinal() > other.ordinal();
    }
}
