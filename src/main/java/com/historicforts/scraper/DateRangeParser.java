package com.historicforts.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts free-text date expressions into ordered {@link Period}s.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Strips surrounding parentheses and spaces, then splits on commas.</li>
 *   <li>Classifies each non-empty segment with the first matching rule of {@link #RULES}.
 *       Rules are anchored at the start of the segment and the last one matches anything, so every
 *       segment produces exactly one period.</li>
 *   <li>Collects every numeric year any period contributes (both candidates of an ambiguous
 *       "1845/1854" included) and reports the minimum and maximum.</li>
 * </ul>
 * <p>
 * Stateless and side-effect free: identical input always yields an equal result.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public final class DateRangeParser {
    private static final Logger logger = LoggerFactory.getLogger(DateRangeParser.class);

    private DateRangeParser() {}

    /** One classified segment and the years it contributes to the earliest/latest bounds. */
    private record Classified(Period period, List<Integer> years) {}

    @FunctionalInterface
    private interface PeriodBuilder {
        Classified build(Matcher match, String segment, int order);
    }

    private record DateRule(Pattern pattern, PeriodBuilder builder) {}

    // Order matters: "1864 - 1871" must be tried before the bare "1864" rule, which would also match it.
    private static final List<DateRule> RULES = List.of(
        new DateRule(Pattern.compile("(\\d{4})\\s*[-–]\\s*(\\d{4})"), (m, s, order) -> {
            int start = Integer.parseInt(m.group(1));
            int end = Integer.parseInt(m.group(2));
            return new Classified(new Period(start, end, null, order, PeriodType.RANGE), List.of(start, end));
        }),
        new DateRule(Pattern.compile("(\\d{4})\\s*[-–]\\s*unknown", Pattern.CASE_INSENSITIVE), (m, s, order) -> {
            int start = Integer.parseInt(m.group(1));
            return new Classified(new Period(start, null, null, order, PeriodType.OPEN_ENDED), List.of(start));
        }),
        // Either year may be the true one; keep the later as end and record both verbatim.
        new DateRule(Pattern.compile("(\\d{4})/(\\d{4})"), (m, s, order) -> {
            int first = Integer.parseInt(m.group(1));
            int second = Integer.parseInt(m.group(2));
            String note = "Ambiguous: " + m.group(1) + "/" + m.group(2);
            return new Classified(new Period(null, second, note, order, PeriodType.AMBIGUOUS), List.of(first, second));
        }),
        new DateRule(Pattern.compile("(\\d{4})"), (m, s, order) -> {
            int year = Integer.parseInt(m.group(1));
            return new Classified(new Period(year, null, null, order, PeriodType.SINGLE_YEAR), List.of(year));
        }),
        new DateRule(Pattern.compile("ca?\\.?\\s*(\\d{4})", Pattern.CASE_INSENSITIVE), (m, s, order) -> {
            int year = Integer.parseInt(m.group(1));
            return new Classified(new Period(year, null, "Approximate date", order, PeriodType.APPROXIMATE), List.of(year));
        }),
        new DateRule(Pattern.compile("(\\d+)(?:st|nd|rd|th)\\s+century", Pattern.CASE_INSENSITIVE), (m, s, order) -> {
            int century = Integer.parseInt(m.group(1));
            int start = (century - 1) * 100;
            int end = century * 100 - 1;
            return new Classified(new Period(start, end, m.group(0), order, PeriodType.CENTURY), List.of(start, end));
        }),
        new DateRule(Pattern.compile(".+", Pattern.DOTALL), (m, s, order) ->
            new Classified(new Period(null, null, "Unparsed: " + s, order, PeriodType.UNPARSED), List.of()))
    );

    /**
     * Parses a raw date string such as {@code "(1775, 1811 - 1814, 1898 - 1899)"}.
     * @param datesRaw raw dates, with or without surrounding parentheses (may be null)
     * @return ordered periods with contiguous {@code periodOrder} and the overall year bounds
     */
    public static ParsedDates parse(String datesRaw) {
        String cleaned = stripParens(datesRaw);
        if (cleaned.isEmpty()) {
            return ParsedDates.EMPTY;
        }
        List<Period> periods = new ArrayList<>();
        Integer earliest = null;
        Integer latest = null;
        for (String part : cleaned.split(",")) {
            String segment = part.trim();
            if (segment.isEmpty()) continue;
            Classified classified = classify(segment, periods.size());
            periods.add(classified.period());
            for (int year : classified.years()) {
                earliest = earliest == null ? year : Math.min(earliest, year);
                latest = latest == null ? year : Math.max(latest, year);
            }
        }
        return new ParsedDates(periods, earliest, latest);
    }

    private static Classified classify(String segment, int order) {
        for (DateRule rule : RULES) {
            Matcher m = rule.pattern().matcher(segment);
            if (m.lookingAt()) {
                Classified classified = rule.builder().build(m, segment, order);
                if (classified.period().periodType() == PeriodType.UNPARSED) {
                    logger.debug("Unparsed date segment: '{}'", segment);
                }
                return classified;
            }
        }
        // Unreachable: the last rule matches any non-empty segment.
        return new Classified(new Period(null, null, "Unparsed: " + segment, order, PeriodType.UNPARSED), List.of());
    }

    // Strips '(', ')' and spaces from both ends.
    private static String stripParens(String s) {
        if (s == null) return "";
        int begin = 0;
        int end = s.length();
        while (begin < end && isParenOrSpace(s.charAt(begin))) begin++;
        while (end > begin && isParenOrSpace(s.charAt(end - 1))) end--;
        return s.substring(begin, end);
    }

    private static boolean isParenOrSpace(char c) {
        return c == '(' || c == ')' || c == ' ';
    }
}
