package com.historicforts.scraper;

import java.util.List;

/**
 * Interface for scraping operations.
 */
public interface ScraperServiceInterface {
    /**
     * Fetches, parses and stores one state page.
     * @param page page to scrape
     * @param force re-scrape even if the page already succeeded
     * @return number of forts found, 0 when skipped or failed
     */
    int scrapePage(PageInfo page, boolean force);

    /**
     * Scrapes pages in order, pausing between requests.
     * @param pages pages to scrape
     * @param force re-scrape pages that already succeeded
     * @param limit maximum number of pages, or 0 for all
     * @return totals and the records parsed during the run
     */
    ScrapeSummary scrapeAll(List<PageInfo> pages, boolean force, int limit);

    /**
     * Fetches and parses a page without storing anything.
     * @param url page URL
     * @return parsed entries, empty when the page cannot be fetched or has none
     */
    List<FortEntry> testPage(String url);
}
