package com.historicforts.scraper;

import java.util.Locale;

/**
 * The date rule that produced a {@link Period}.
 * <p>
 * Persisted as the {@code period_type} column so that a {@code null} end year can be read back
 * with its meaning: {@link #OPEN_ENDED} ("1864 - unknown") versus {@link #SINGLE_YEAR}
 * ("1864", nothing further stated).
 */
public enum PeriodType {
    RANGE,
    OPEN_ENDED,
    AMBIGUOUS,
    SINGLE_YEAR,
    APPROXIMATE,
    CENTURY,
    UNPARSED;

    /**
     * Lower-case label used in the database and CSV exports.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Reverse of {@link #label()}.
     * @return the matching type, or null for a null or unknown label
     */
    public static PeriodType fromLabel(String label) {
        if (label == null) return null;
        for (PeriodType type : values()) {
            if (type.label().equals(label.trim().toLowerCase(Locale.ROOT))) return type;
        }
        return null;
    }
}
