package com.historicforts.scraper;

import java.util.List;

/**
 * Immutable record representing one fortification entry parsed from a source page.
 * <p>
 * Extraction Workflow:
 * <ul>
 *   <li>{@link EntryExtractor} slices the page into {@link EntryFragment}s.</li>
 *   <li>{@link FieldSegmenter} splits unsegmented fragments into name, dates, location and description.</li>
 *   <li>{@link DateRangeParser}, {@link NationalityExtractor}, {@link AltNameExtractor} and
 *       {@link FortTypeClassifier} fill the derived fields.</li>
 *   <li>{@link EntryAssembler} builds this record and adapts it to the storage shape ({@link FortRecord}).</li>
 * </ul>
 * <p>
 * {@code namePrimary} is never empty and {@code entryRaw} always holds (or summarises) the source
 * text so every record can be traced back to the page. Lists are copied on construction.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public record FortEntry(
    String namePrimary,
    String datesRaw,
    String locationText,
    String descriptionRaw,
    String entryRaw,
    List<String> altNames,
    List<String> nationalities,
    List<Period> periods,
    Integer earliestYear,
    Integer latestYear,
    String fortType
) {
    public FortEntry {
        if (namePrimary == null || namePrimary.isBlank()) {
            throw new IllegalArgumentException("namePrimary cannot be null or blank");
        }
        datesRaw = datesRaw == null ? "" : datesRaw;
        locationText = locationText == null ? "" : locationText;
        descriptionRaw = descriptionRaw == null ? "" : descriptionRaw;
        entryRaw = entryRaw == null ? "" : entryRaw;
        altNames = altNames == null ? List.of() : List.copyOf(altNames);
        nationalities = nationalities == null ? List.of() : List.copyOf(nationalities);
        periods = periods == null ? List.of() : List.copyOf(periods);
        fortType = fortType == null ? FortTypeClassifier.DEFAULT_TYPE : fortType;
    }
}
