package com.historicforts.scraper;

import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mines alternate fort names from emphasised spans of a description.
 * <p>
 * Two variants:
 * <ul>
 *   <li>{@link #fromText(String)} for plain descriptions with {@code **bold**} markers. Phrase-anchored
 *       patterns ("also known as **X**", "renamed **X**") are tried first; the bare {@code **X**}
 *       pattern is used only when none of them matched. Candidates starting with an article or
 *       demonstrative are rejected.</li>
 *   <li>{@link #fromHtml(String)} for description markup: {@code <b>} and {@code <strong>} spans that
 *       start with a capital letter, are longer than three characters and are not link/UI text.</li>
 * </ul>
 * Both return names in first-seen order without duplicates.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public final class AltNameExtractor {

    private static final List<Pattern> PHRASE_PATTERNS = List.of(
        Pattern.compile("(?:(?:first|originally|also|formerly|later|previously) )?(?:known|called|named|designated) as \\*\\*([^*]+)\\*\\*", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:renamed|changed to) \\*\\*([^*]+)\\*\\*", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern BARE_EMPHASIS = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern LEADING_STOPWORD = Pattern.compile("^(?:the|a|an|this|that)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern BOLD_TAG = Pattern.compile("<(?:b|strong)(?:\\s[^>]*)?>([^<]+)</(?:b|strong)\\s*>", Pattern.CASE_INSENSITIVE);
    private static final List<String> UI_PHRASES = List.of("the ", "click", "here", "see ");

    private AltNameExtractor() {}

    /**
     * Extracts alternate names from a plain-text description.
     * @param description description text (may be null)
     * @return ordered, de-duplicated names
     */
    public static List<String> fromText(String description) {
        if (description == null || description.isEmpty()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        for (Pattern pattern : PHRASE_PATTERNS) {
            collect(pattern, description, names);
        }
        if (names.isEmpty()) {
            collect(BARE_EMPHASIS, description, names);
        }
        return new ArrayList<>(names);
    }

    /**
     * Extracts alternate names from bold/strong spans in description markup.
     * @param html description markup (may be null)
     * @return ordered, de-duplicated names
     */
    public static List<String> fromHtml(String html) {
        if (html == null || html.isEmpty()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        Matcher m = BOLD_TAG.matcher(html);
        while (m.find()) {
            String name = Parser.unescapeEntities(m.group(1), false).replace('\u00A0', ' ').trim();
            if (looksLikeName(name)) names.add(name);
        }
        return new ArrayList<>(names);
    }

    private static void collect(Pattern pattern, String text, Set<String> names) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String name = m.group(1).trim();
            if (!name.isEmpty() && !LEADING_STOPWORD.matcher(name).find()) {
                names.add(name);
            }
        }
    }

    private static boolean looksLikeName(String name) {
        if (name.length() <= 3 || !Character.isUpperCase(name.charAt(0))) return false;
        String lower = name.toLowerCase(Locale.ROOT);
        for (String phrase : UI_PHRASES) {
            if (lower.contains(phrase)) return false;
        }
        return true;
    }
}
