package com.historicforts.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one unsegmented entry string into name, dates, location and description.
 * <p>
 * Layouts are tried in order and the first match wins:
 * <ol>
 *   <li>{@code Name (dates), Location - Description}</li>
 *   <li>{@code Name (dates), Remainder}: the first sentence of the remainder is the location, the rest
 *       is the description</li>
 *   <li>{@code Name (dates) Remainder}: the remainder is the description, location is empty</li>
 *   <li>anything else: the raw text becomes name (first 100 characters), description and entryRaw</li>
 * </ol>
 * The dash separator is a hyphen with whitespace on both sides or an en-dash, so hyphenated place
 * names such as "Wilkes-Barre" stay whole. Location text is only trimmed, never rewritten: leading
 * "near" and trailing "?" markers are needed by the geocoder.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public final class FieldSegmenter {
    private static final Logger logger = LoggerFactory.getLogger(FieldSegmenter.class);

    static final int FALLBACK_NAME_LENGTH = 100;
    static final String UNNAMED = "(unnamed entry)";

    private static final Pattern NAME_DATES_LOCATION_DESCRIPTION =
        Pattern.compile("^(.+?)\\s*\\(([^)]+)\\)\\s*,\\s*(.+?)(?:\\s+-(?:\\s+|$)|\\s*–\\s*)(.*)$");
    private static final Pattern NAME_DATES_REMAINDER =
        Pattern.compile("^(.+?)\\s*\\(([^)]+)\\)\\s*,\\s*(.+)$");
    private static final Pattern NAME_DATES_DESCRIPTION =
        Pattern.compile("^(.+?)\\s*\\(([^)]+)\\)\\s*(.*)$");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    private static final Pattern BRACKETED = Pattern.compile("\\[[^\\]]*]");
    private static final Pattern EMPHASIS = Pattern.compile("\\*+");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    /**
     * Fields split from one entry string.
     * @param datesRaw dates wrapped in parentheses, or empty
     * @param parsed false when no layout matched and the raw-text fallback was used
     */
    public record Segments(String name, String datesRaw, String locationText, String descriptionRaw,
                           String entryRaw, boolean parsed) {}

    private FieldSegmenter() {}

    /**
     * Segments an entry string. Never fails: unrecognised layouts produce the raw-text fallback.
     * @param rawText entry text (may be null)
     * @return segmented fields with a non-empty name
     */
    public static Segments segment(String rawText) {
        String text = normalizeWhitespace(rawText);

        Matcher m = NAME_DATES_LOCATION_DESCRIPTION.matcher(text);
        if (m.matches()) {
            return build(m.group(1), m.group(2), m.group(3), m.group(4), text);
        }
        m = NAME_DATES_REMAINDER.matcher(text);
        if (m.matches()) {
            String[] sentences = SENTENCE_END.split(m.group(3).trim(), 2);
            String description = sentences.length > 1 ? sentences[1] : "";
            return build(m.group(1), m.group(2), sentences[0], description, text);
        }
        m = NAME_DATES_DESCRIPTION.matcher(text);
        if (m.matches()) {
            return build(m.group(1), m.group(2), "", m.group(3), text);
        }

        logger.debug("Unrecognised entry layout, keeping raw text: '{}'", abbreviate(text));
        String raw = rawText == null ? "" : rawText;
        return new Segments(fallbackName(raw), "", "", raw, raw, false);
    }

    /**
     * Name for text that could not be segmented: its first 100 characters after whitespace
     * normalisation, or {@value #UNNAMED} for blank text.
     */
    public static String fallbackName(String rawText) {
        String text = normalizeWhitespace(rawText);
        return text.isEmpty() ? UNNAMED : text.substring(0, Math.min(FALLBACK_NAME_LENGTH, text.length())).trim();
    }

    /**
     * Removes {@code [bracketed]} annotations and {@code *} emphasis markers from a name.
     * Falls back to the trimmed input when cleaning would leave nothing.
     */
    public static String cleanName(String name) {
        if (name == null) return "";
        String cleaned = BRACKETED.matcher(name).replaceAll(" ");
        cleaned = EMPHASIS.matcher(cleaned).replaceAll(" ");
        cleaned = normalizeWhitespace(cleaned);
        return cleaned.isEmpty() ? normalizeWhitespace(name) : cleaned;
    }

    /**
     * Collapses runs of whitespace (non-breaking spaces included) to one space and trims.
     */
    public static String normalizeWhitespace(String s) {
        if (s == null) return "";
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    private static Segments build(String name, String dates, String location, String description, String text) {
        String cleanedName = cleanName(name);
        if (cleanedName.isEmpty()) cleanedName = UNNAMED;
        return new Segments(cleanedName, "(" + dates.trim() + ")", location.trim(), description.trim(), text, true);
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 80) + "...";
    }
}
