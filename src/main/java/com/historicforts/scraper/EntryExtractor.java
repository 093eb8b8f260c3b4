package com.historicforts.scraper;

import com.historicforts.scraper.MarkupToken.Kind;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Segments a whole page into {@link EntryFragment}s.
 * <p>
 * Workflow:
 * <ul>
 *   <li><b>Markup strategy.</b> Walks the {@link MarkupTokenizer} output looking for the repeating
 *       entry layout: a named anchor holding the fort name, optional flag images, line breaks and
 *       {@code </FONT>} markers, an italic block with "(dates), location", an optional line break,
 *       then the description up to the next entry boundary ({@link MarkupToken#isEntryBoundary()}).
 *       A named anchor followed directly by plain "(dates) ..." text is taken as an unsegmented
 *       entry for {@link FieldSegmenter}.</li>
 *   <li><b>Plain-text strategy</b>, only when the markup strategy found nothing. The page body is
 *       flattened to one line per text node and scanned for lines starting with a capitalised name
 *       followed by a parenthesised four-digit year. Flag images are lost in flattening, so
 *       nationalities are recovered from a window of raw markup around the first occurrence of the
 *       name. Each match already separates name, dates, location and description, so the fragment
 *       is built segmented and the location is kept exactly as captured.</li>
 * </ul>
 * <p>
 * Neither strategy throws; a strategy that fails is logged and treated as having found nothing.
 * An empty result is a normal outcome for pages without entries.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public final class EntryExtractor {
    private static final Logger logger = LoggerFactory.getLogger(EntryExtractor.class);

    static final int FLAG_WINDOW = 100;
    static final int FALLBACK_DESCRIPTION_LIMIT = 1000;

    private static final Pattern DATES_AND_LOCATION = Pattern.compile("^\\(([^)]*)\\)\\s*,?\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern TEXT_ENTRY = Pattern.compile(
        "^([A-Z][^(\\n]*?)\\s*\\((\\d{4}[^)]*)\\)[ \\t]*,?[ \\t]*([^\\n]*?)[ \\t]*(?:\\n|$)(.*?)(?=^[A-Z][^(\\n]*?\\s*\\(\\d{4}|\\z)",
        Pattern.MULTILINE | Pattern.DOTALL);

    private EntryExtractor() {}

    /**
     * Extracts the entry fragments of one page, in page order.
     * @param html raw page markup (may be null)
     * @param sourceUrl page URL, used for log context only
     * @return fragments, or an empty list when neither strategy recognises an entry
     */
    public static List<EntryFragment> extract(String html, String sourceUrl) {
        if (html == null || html.isBlank()) {
            logger.debug("Empty page content for {}", sourceUrl);
            return List.of();
        }
        List<EntryFragment> fragments;
        try {
            fragments = extractFromMarkup(MarkupTokenizer.tokenize(html));
        } catch (RuntimeException e) {
            logger.warn("Markup extraction failed for {}: {}", sourceUrl, e.getMessage());
            fragments = List.of();
        }
        if (!fragments.isEmpty()) {
            logger.debug("Markup strategy found {} entries in {}", fragments.size(), sourceUrl);
            return fragments;
        }
        try {
            fragments = extractFromText(html);
        } catch (RuntimeException e) {
            logger.warn("Plain-text extraction failed for {}: {}", sourceUrl, e.getMessage());
            fragments = List.of();
        }
        logger.debug("Plain-text strategy found {} entries in {}", fragments.size(), sourceUrl);
        return fragments;
    }

    /**
     * Markup strategy over a token stream.
     */
    static List<EntryFragment> extractFromMarkup(List<MarkupToken> tokens) {
        List<EntryFragment> fragments = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            if (!tokens.get(i).isNamedAnchor()) {
                i++;
                continue;
            }
            int next = matchEntry(tokens, i, fragments);
            i = next > i ? next : i + 1;
        }
        return fragments;
    }

    /**
     * Tries to read one entry starting at the named anchor {@code start}.
     * @return index of the token that ended the entry, or {@code start} when no entry matched
     */
    private static int matchEntry(List<MarkupToken> tokens, int start, List<EntryFragment> out) {
        int i = start + 1;
        StringBuilder name = new StringBuilder();
        while (i < tokens.size() && !tokens.get(i).is(Kind.ANCHOR_CLOSE)) {
            MarkupToken t = tokens.get(i);
            if (t.is(Kind.TEXT)) {
                name.append(t.value());
            } else if (!t.is(Kind.BOLD_OPEN) && !t.is(Kind.BOLD_CLOSE)) {
                return start;
            }
            i++;
        }
        String fortName = FieldSegmenter.normalizeWhitespace(name.toString());
        if (i >= tokens.size() || fortName.isEmpty()) return start;
        i++;

        // Flags, line breaks and closing font tags between the name and the dates.
        List<MarkupToken> flags = new ArrayList<>();
        while (i < tokens.size()) {
            MarkupToken t = tokens.get(i);
            if (t.is(Kind.IMAGE)) {
                flags.add(t);
            } else if (!t.is(Kind.LINE_BREAK) && !t.is(Kind.FONT_CLOSE) && !t.isBlankText()) {
                break;
            }
            i++;
        }
        if (i >= tokens.size()) return start;
        List<String> nationalities = NationalityExtractor.extract(MarkupTokenizer.toMarkup(flags));

        if (tokens.get(i).is(Kind.ITALIC_OPEN)) {
            return matchItalicEntry(tokens, i, fortName, nationalities, out, start);
        }
        if (tokens.get(i).is(Kind.TEXT) && tokens.get(i).value().stripLeading().startsWith("(")) {
            int end = descriptionEnd(tokens, i);
            String text = fortName + " " + MarkupTokenizer.flattenText(tokens.subList(i, end));
            out.add(EntryFragment.unsegmented(text, nationalities));
            return end;
        }
        return start;
    }

    private static int matchItalicEntry(List<MarkupToken> tokens, int italicOpen, String fortName,
                                        List<String> nationalities, List<EntryFragment> out, int start) {
        int i = italicOpen + 1;
        StringBuilder italic = new StringBuilder();
        while (i < tokens.size() && !tokens.get(i).is(Kind.ITALIC_CLOSE)) {
            MarkupToken t = tokens.get(i);
            if (!t.is(Kind.TEXT)) return start;
            italic.append(t.value());
            i++;
        }
        if (i >= tokens.size()) return start;
        i++;
        while (i < tokens.size() && tokens.get(i).isBlankText()) i++;
        if (i < tokens.size() && tokens.get(i).is(Kind.LINE_BREAK)) i++;

        int end = descriptionEnd(tokens, i);
        List<MarkupToken> description = tokens.subList(i, end);

        String dateLocation = FieldSegmenter.normalizeWhitespace(italic.toString());
        String dates = "";
        String location = dateLocation;
        Matcher m = DATES_AND_LOCATION.matcher(dateLocation);
        if (m.matches()) {
            dates = m.group(1).trim();
            location = m.group(2).trim();
        }
        out.add(EntryFragment.segmented(fortName, dates, location,
            MarkupTokenizer.flattenText(description), MarkupTokenizer.toMarkup(description), nationalities));
        return end;
    }

    private static int descriptionEnd(List<MarkupToken> tokens, int from) {
        int i = from;
        while (i < tokens.size() && !tokens.get(i).isEntryBoundary()) i++;
        return i;
    }

    /**
     * Plain-text strategy over the flattened page body.
     */
    static List<EntryFragment> extractFromText(String html) {
        Document doc = Jsoup.parse(html);
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                text.append(((TextNode) node).getWholeText()).append('\n');
            }
        }, doc.body());

        List<EntryFragment> fragments = new ArrayList<>();
        Matcher m = TEXT_ENTRY.matcher(text);
        while (m.find()) {
            String name = m.group(1).trim();
            if (name.isEmpty()) continue;
            String dates = m.group(2).trim();
            String location = m.group(3).trim();
            String description = FieldSegmenter.normalizeWhitespace(m.group(4));
            if (description.length() > FALLBACK_DESCRIPTION_LIMIT) {
                description = description.substring(0, FALLBACK_DESCRIPTION_LIMIT);
            }
            fragments.add(EntryFragment.segmented(name, dates, location, description, "", flagsNear(html, name)));
        }
        return fragments;
    }

    private static List<String> flagsNear(String html, String name) {
        int idx = indexOfName(html, name);
        if (idx < 0) return List.of();
        int from = Math.max(0, idx - FLAG_WINDOW);
        int to = Math.min(html.length(), idx + FLAG_WINDOW);
        return NationalityExtractor.extract(html.substring(from, to));
    }

    /**
     * Position of a decoded name in raw markup. When the literal name is absent, punctuation may
     * appear as an entity ({@code &#39;}, {@code &amp;}) and spaces as {@code &nbsp;}.
     * @return index of the first occurrence, or -1
     */
    static int indexOfName(String html, String name) {
        int idx = html.indexOf(name);
        if (idx >= 0 || name.isEmpty()) return idx;
        Matcher m = encodedName(name).matcher(html);
        return m.find() ? m.start() : -1;
    }

    private static Pattern encodedName(String name) {
        StringBuilder regex = new StringBuilder();
        boolean inSpace = false;
        for (char c : name.toCharArray()) {
            if (Character.isWhitespace(c) || c == '\u00A0') {
                if (!inSpace) regex.append("(?:\\s|&nbsp;|&#160;|&#x[aA]0;)+");
                inSpace = true;
                continue;
            }
            inSpace = false;
            if (Character.isLetterOrDigit(c)) {
                regex.append(c);
            } else {
                regex.append("(?:").append(Pattern.quote(String.valueOf(c))).append("|&#?\\w+;)");
            }
        }
        return Pattern.compile(regex.toString());
    }
}
