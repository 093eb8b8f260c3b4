package com.historicforts.scraper;

import java.util.List;

/**
 * A slice of page content believed to describe exactly one fortification.
 * <p>
 * Segmented fragments already carry their fields; they come from the italic markup layout and
 * from the plain-text fallback, and their entryRaw is the one-line summary built by
 * {@link EntryAssembler#summarize}. Unsegmented fragments only carry {@code rawText}, the entry text
 * exactly as found on the page, and go through {@link FieldSegmenter}; {@code rawText} is empty for
 * segmented fragments. {@code descriptionHtml} is kept for the markup variant of
 * {@link AltNameExtractor}; it is empty when there is no description markup.
 */
public record EntryFragment(
    boolean segmented,
    String rawText,
    String name,
    String datesRaw,
    String locationText,
    String descriptionText,
    String descriptionHtml,
    List<String> nationalities
) {
    public EntryFragment {
        rawText = rawText == null ? "" : rawText;
        name = name == null ? "" : name;
        datesRaw = datesRaw == null ? "" : datesRaw;
        locationText = locationText == null ? "" : locationText;
        descriptionText = descriptionText == null ? "" : descriptionText;
        descriptionHtml = descriptionHtml == null ? "" : descriptionHtml;
        nationalities = nationalities == null ? List.of() : List.copyOf(nationalities);
    }

    /**
     * Fragment whose fields are already split.
     * @param datesRaw dates without the surrounding parentheses
     */
    public static EntryFragment segmented(String name, String datesRaw, String locationText,
                                          String descriptionText, String descriptionHtml, List<String> nationalities) {
        return new EntryFragment(true, null, name, datesRaw, locationText, descriptionText, descriptionHtml, nationalities);
    }

    /**
     * Fragment holding a single raw string for {@link FieldSegmenter}.
     */
    public static EntryFragment unsegmented(String rawText, List<String> nationalities) {
        return new EntryFragment(false, rawText, null, null, null, null, null, nationalities);
    }
}
