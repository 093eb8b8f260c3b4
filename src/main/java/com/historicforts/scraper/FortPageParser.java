package com.historicforts.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the parsing core: one page of HTML in, an ordered list of fort entries out.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link EntryExtractor} slices the page into fragments (markup strategy, then plain-text fallback).</li>
 *   <li>{@link EntryAssembler} turns each fragment into a {@link FortEntry}.</li>
 *   <li>{@link #parsePage(String, PageSource)} additionally adapts each entry to a {@link FortRecord}.</li>
 * </ul>
 * <p>
 * Error handling: nothing here throws for malformed input. A fragment that fails to assemble is
 * logged and kept as a raw-text entry, so every fragment yields exactly one entry. The class holds
 * no state and touches neither network nor disk; pages may be parsed concurrently.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public final class FortPageParser {
    private static final Logger logger = LoggerFactory.getLogger(FortPageParser.class);

    private FortPageParser() {}

    /**
     * Parses all fort entries of a page.
     * @param html raw page markup (may be null or empty)
     * @param sourceUrl page URL, for log context
     * @return entries in page order; empty when the page has none
     */
    public static List<FortEntry> parseEntries(String html, String sourceUrl) {
        List<EntryFragment> fragments = EntryExtractor.extract(html, sourceUrl);
        List<FortEntry> entries = new ArrayList<>(fragments.size());
        for (EntryFragment fragment : fragments) {
            try {
                entries.add(EntryAssembler.assemble(fragment));
            } catch (RuntimeException e) {
                logger.warn("Failed to assemble entry on {}, keeping raw text: {}", sourceUrl, e.getMessage());
                String raw = fragment.segmented()
                    ? EntryAssembler.summarize(fragment.name(), fragment.datesRaw(), fragment.locationText(), fragment.descriptionText())
                    : fragment.rawText();
                entries.add(EntryAssembler.rawTextEntry(raw, fragment.nationalities()));
            }
        }
        if (entries.isEmpty()) {
            logger.info("No fort entries found on {}", sourceUrl);
        } else {
            logger.debug("Parsed {} fort entries from {}", entries.size(), sourceUrl);
        }
        return entries;
    }

    /**
     * Parses a page and adapts every entry to the storage shape.
     * @param html raw page markup
     * @param source page URL, state and section
     * @return records in page order
     */
    public static List<FortRecord> parsePage(String html, PageSource source) {
        List<FortRecord> records = new ArrayList<>();
        for (FortEntry entry : parseEntries(html, source.sourceUrl())) {
            records.add(EntryAssembler.toRecord(entry, source));
        }
        return records;
    }
}
