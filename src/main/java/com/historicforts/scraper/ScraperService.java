package com.historicforts.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the fetch, parse and store cycle over state pages.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Skips pages whose last scrape succeeded unless forced.</li>
 *   <li>Fetches the page; a fetch failure is written to the scrape log as {@code error}.</li>
 *   <li>Parses it with {@link FortPageParser}, upserts every fort with its periods and logs
 *       {@code success} with the number of forts found.</li>
 *   <li>{@link #scrapeAll} waits the configured delay between pages and counts outcomes.</li>
 * </ul>
 * A page that throws is logged and counted as an error; the run continues with the next page.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public class ScraperService implements ScraperServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ScraperService.class);

    private final FetchServiceInterface fetcher;
    private final PostgresServiceInterface store;
    private final ScraperConfig config;

    private enum Status { SKIPPED, FAILED, SCRAPED }

    private record PageOutcome(Status status, List<FortRecord> records) {
        static final PageOutcome SKIPPED = new PageOutcome(Status.SKIPPED, List.of());
        static final PageOutcome FAILED = new PageOutcome(Status.FAILED, List.of());
    }

    public ScraperService(FetchServiceInterface fetcher, PostgresServiceInterface store, ScraperConfig config) {
        this.fetcher = fetcher;
        this.store = store;
        this.config = config;
    }

    @Override
    public int scrapePage(PageInfo page, boolean force) {
        return scrape(page, force).records().size();
    }

    private PageOutcome scrape(PageInfo page, boolean force) {
        String url = page.url();
        if (!force) {
            ScrapeLogEntry status = store.getScrapeStatus(url);
            if (status != null && status.isSuccess()) {
                logger.info("Skipping {} (already scraped, {} forts)", url, status.fortsFound());
                return PageOutcome.SKIPPED;
            }
        }
        logger.info("Scraping {} ({})", page.filename(), page.stateName());

        FetchResult result = fetcher.fetch(url);
        if (!result.isSuccess()) {
            logger.error("Failed to fetch {}: {}", url, result.error());
            store.logScrape(url, ScrapeLogEntry.ERROR, 0, result.error());
            return PageOutcome.FAILED;
        }

        List<FortRecord> records = FortPageParser.parsePage(result.html(), page.toSource());
        logger.info("Found {} fort entries on {}", records.size(), page.filename());

        int failed = 0;
        for (FortRecord record : records) {
            if (store.insertFort(record) <= 0) failed++;
        }
        if (failed > 0) {
            logger.warn("{} of {} forts from {} could not be stored", failed, records.size(), url);
        }
        store.logScrape(url, ScrapeLogEntry.SUCCESS, records.size(), null);
        return new PageOutcome(Status.SCRAPED, records);
    }

    @Override
    public ScrapeSummary scrapeAll(List<PageInfo> pages, boolean force, int limit) {
        List<PageInfo> selected = limit > 0 && limit < pages.size() ? pages.subList(0, limit) : pages;
        if (selected.size() < pages.size()) {
            logger.info("Limiting to {} of {} pages", selected.size(), pages.size());
        }
        int withData = 0;
        int skipped = 0;
        int errors = 0;
        List<FortRecord> records = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            PageInfo page = selected.get(i);
            logger.info("[{}/{}] {}", i + 1, selected.size(), page.url());
            try {
                PageOutcome outcome = scrape(page, force);
                switch (outcome.status()) {
                    case SKIPPED -> skipped++;
                    case FAILED -> errors++;
                    case SCRAPED -> {
                        if (!outcome.records().isEmpty()) withData++;
                        records.addAll(outcome.records());
                    }
                }
            } catch (RuntimeException e) {
                logger.error("Error scraping {}: {}", page.url(), e.getMessage());
                errors++;
            }
            if (i < selected.size() - 1 && !Utils.sleep(config.requestDelayMs())) {
                logger.warn("Interrupted, stopping after {} pages", i + 1);
                return new ScrapeSummary(i + 1, withData, skipped, errors, records);
            }
        }
        ScrapeSummary summary = new ScrapeSummary(selected.size(), withData, skipped, errors, records);
        logger.info("Scraping complete: {} pages, {} with data, {} skipped, {} errors, {} forts",
            summary.pagesProcessed(), summary.pagesWithData(), summary.pagesSkipped(), summary.errors(), summary.totalForts());
        return summary;
    }

    @Override
    public List<FortEntry> testPage(String url) {
        FetchResult result = fetcher.fetch(url);
        if (!result.isSuccess()) {
            logger.error("Error fetching page {}: {}", url, result.error());
            return List.of();
        }
        return FortPageParser.parseEntries(result.html(), url);
    }
}
