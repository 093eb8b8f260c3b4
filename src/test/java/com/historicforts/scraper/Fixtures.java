package com.historicforts.scraper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Test pages under src/test/resources/pages and small builders shared by the tests.
 */
final class Fixtures {

    static final String CT_URL = "https://www.northamericanforts.com/East/ct.html";
    static final PageSource CT_SOURCE = new PageSource(CT_URL, "ct", "Connecticut", "East");

    private Fixtures() {}

    static String page(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/pages/" + name)) {
            if (in == null) throw new IllegalStateException("Missing test page: " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static ScraperConfig config() {
        return new ScraperConfig("https://example.org", List.of("East", "West"), 0L, 5, "FortsScraper/test",
            1, "", "postgres", "postgres", 5432, "target/pgdata", "target/scraped-data");
    }

    static FortRecord record(String name, String dates, String state) {
        ParsedDates parsed = DateRangeParser.parse(dates);
        FortEntry entry = new FortEntry(name, dates, "near Town", "A post, with a comma.", name + " " + dates,
            List.of(), List.of("United States"), parsed.periods(), parsed.earliestYear(), parsed.latestYear(), "fort");
        return new FortRecord(entry, new PageSource("https://example.org/East/" + state + ".html", state,
            FortVocabulary.stateName(state), "East"));
    }
}
