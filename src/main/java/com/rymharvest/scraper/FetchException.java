package com.rymharvest.scraper;

/**
 * Raised when a page could not be retrieved. Fatal for the scraper that requested the page.
 */
public class FetchException extends Exception {
    private final String url;

    public FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
