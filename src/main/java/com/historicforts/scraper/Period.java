package com.historicforts.scraper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record for one contiguous span of a fortification's activity.
 * <p>
 * A {@code null} {@code endYear} means the end was not stated (or explicitly "unknown"); it never
 * means "still active". {@code periodOrder} is the zero-based position of the date segment in the
 * source string.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public record Period(
    Integer startYear,
    Integer endYear,
    String periodNotes,
    int periodOrder,
    PeriodType periodType
) {

    /**
     * Flattens this period to the storage shape (start_year, end_year, period_notes, period_order).
     * @return insertion-ordered map; absent values are {@code null}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("start_year", startYear);
        map.put("end_year", endYear);
        map.put("period_notes", periodNotes);
        map.put("period_order", periodOrder);
        return map;
    }
}
