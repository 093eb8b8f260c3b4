package com.historicforts.scraper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Storage-ready view of a {@link FortEntry} together with the page it was read from.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #toMap()} flattens the entry to the fort row: multi-valued fields are joined with
 *       {@value #LIST_DELIMITER}, empty text becomes {@code null} and the state code is upper-cased.</li>
 *   <li>{@link #periodMaps()} returns the child rows in source order; the storage layer keys them to
 *       the fort row it created.</li>
 * </ul>
 * Consumed by {@link PostgresService} and {@link CsvService}; column names in both follow {@link #COLUMNS}.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public record FortRecord(FortEntry entry, PageSource source) {

    public static final String LIST_DELIMITER = "|";

    public static final List<String> COLUMNS = List.of(
        "name_primary", "alt_names", "state_territory", "state_full_name", "location_text", "fort_type",
        "nationality", "dates_raw", "earliest_year", "latest_year", "source_url", "source_section",
        "description_raw", "entry_raw"
    );

    public FortRecord {
        if (entry == null || source == null) {
            throw new IllegalArgumentException("entry and source are required");
        }
    }

    public String stateTerritory() {
        return source.stateCode() == null ? null : source.stateCode().toUpperCase(Locale.ROOT);
    }

    public List<Period> periods() {
        return entry.periods();
    }

    /**
     * @return the fort row keyed by {@link #COLUMNS}, in that order
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name_primary", entry.namePrimary());
        map.put("alt_names", joinOrNull(entry.altNames()));
        map.put("state_territory", stateTerritory());
        map.put("state_full_name", source.stateName());
        map.put("location_text", emptyToNull(entry.locationText()));
        map.put("fort_type", entry.fortType());
        map.put("nationality", joinOrNull(entry.nationalities()));
        map.put("dates_raw", emptyToNull(entry.datesRaw()));
        map.put("earliest_year", entry.earliestYear());
        map.put("latest_year", entry.latestYear());
        map.put("source_url", source.sourceUrl());
        map.put("source_section", source.section());
        map.put("description_raw", emptyToNull(entry.descriptionRaw()));
        map.put("entry_raw", emptyToNull(entry.entryRaw()));
        return map;
    }

    /**
     * @return one map per period (start_year, end_year, period_notes, period_order), in source order
     */
    public List<Map<String, Object>> periodMaps() {
        List<Map<String, Object>> maps = new ArrayList<>();
        for (Period period : entry.periods()) maps.add(period.toMap());
        return maps;
    }

    private static String joinOrNull(List<String> values) {
        return values.isEmpty() ? null : String.join(LIST_DELIMITER, values);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
