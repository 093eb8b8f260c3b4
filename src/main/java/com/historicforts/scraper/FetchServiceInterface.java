package com.historicforts.scraper;

/**
 * Interface for retrieving page markup over HTTP.
 */
public interface FetchServiceInterface {
    /**
     * Fetches a page.
     * @param url absolute page URL
     * @return the body, or the error that prevented fetching it; never null
     */
    FetchResult fetch(String url);
}
