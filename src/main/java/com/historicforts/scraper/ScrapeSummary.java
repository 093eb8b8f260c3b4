package com.historicforts.scraper;

import java.util.List;

/**
 * Totals of one scrape run.
 * @param pagesWithData pages that yielded at least one fort
 * @param errors pages that could not be fetched or processed
 * @param records every fort record parsed during the run, in page order
 */
public record ScrapeSummary(int pagesProcessed, int pagesWithData, int pagesSkipped, int errors, List<FortRecord> records) {

    public ScrapeSummary {
        records = List.copyOf(records);
    }

    public int totalForts() {
        return records.size();
    }
}
