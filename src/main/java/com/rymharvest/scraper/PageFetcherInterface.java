package com.rymharvest.scraper;

import org.jsoup.nodes.Document;

/**
 * Interface for retrieving a parsed page for a URL.
 */
public interface PageFetcherInterface {
    /**
     * Fetches and parses the page at the given URL.
     * @param url absolute page URL
     * @return parsed document whose base URI is {@code url}
     * @throws FetchException if the page cannot be retrieved
     */
    Document fetch(String url) throws FetchException;
}
