package com.rymharvest.scraper;

/**
 * One diagnostic entry recorded while scraping.
 *
 * @param status outcome category
 * @param source scraper that recorded it, e.g. {@code "RYM Artist https://..."}
 * @param message human readable detail
 */
public record ScrapeDiagnostic(Status status, String source, String message) {

    public enum Status {
        SUCCESS,
        INFO,
        /** A field was missing or malformed and its default was substituted. */
        DEGRADED,
        ERROR
    }

    @Override
    public String toString() {
        return "[" + status + "] " + source + ": " + message;
    }
}
