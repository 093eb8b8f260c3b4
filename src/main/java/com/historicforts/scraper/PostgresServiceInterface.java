package com.historicforts.scraper;

import java.util.List;
import java.util.Map;

/**
 * Interface for the fort database used by the scraper.
 */
public interface PostgresServiceInterface {
    /**
     * Creates the forts, fort_periods and scrape_log tables if they don't already exist.
     */
    void createTables();

    /**
     * Inserts a fort, or updates the row with the same name, state and source URL, and replaces
     * its periods with the record's periods.
     * @param record fort to store
     * @return the fort ID if successful, -1 if failed
     */
    int insertFort(FortRecord record);

    /**
     * Appends periods to an existing fort.
     * @param fortId ID returned by {@link #insertFort(FortRecord)}
     * @param periods periods in source order
     */
    void insertPeriods(int fortId, List<Period> periods);

    /**
     * Records the outcome of scraping a page, replacing any earlier entry for the URL.
     */
    void logScrape(String url, String status, int fortsFound, String errorMessage);

    /**
     * @return the last scrape attempt for the URL, or null if it was never scraped
     */
    ScrapeLogEntry getScrapeStatus(String url);

    /**
     * Reads every stored fort with its periods, ordered by state and name; periods keep their order.
     * @return all forts, or an empty list if the read fails
     */
    List<FortRecord> getAllForts();

    /**
     * @return total_forts, total_periods, pages_scraped and forts_by_state (largest first)
     */
    Map<String, Object> getStats();
}
