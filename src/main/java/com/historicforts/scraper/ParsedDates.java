package com.historicforts.scraper;

import java.util.List;

/**
 * Result of {@link DateRangeParser#parse(String)}: ordered periods plus the overall year bounds.
 * Both bounds are {@code null} when no period yielded a number.
 */
public record ParsedDates(List<Period> periods, Integer earliestYear, Integer latestYear) {

    public static final ParsedDates EMPTY = new ParsedDates(List.of(), null, null);

    public ParsedDates {
        periods = periods == null ? List.of() : List.copyOf(periods);
    }
}
