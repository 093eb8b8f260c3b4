package com.historicforts.scraper;

import com.historicforts.scraper.MarkupToken.Kind;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient lexer that turns raw page markup into a flat list of {@link MarkupToken}s.
 * <p>
 * The source pages are hand-written HTML from several decades and routinely contain unclosed,
 * mis-nested or unquoted tags, so no tree is built. The lexer only recognises where a tag starts
 * and ends and classifies it by name:
 * <ul>
 *   <li>A {@code <} not followed by a letter, {@code /} or {@code !} is literal text.</li>
 *   <li>A tag without a closing {@code >} turns the rest of the input into text.</li>
 *   <li>Comments become a single {@link Kind#COMMENT} token.</li>
 *   <li>Text runs carry their entity-decoded content in {@link MarkupToken#value()}.</li>
 * </ul>
 * Every character of the input belongs to exactly one token.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public final class MarkupTokenizer {

    private static final Pattern TAG_NAME = Pattern.compile("^/?\\s*([a-zA-Z][a-zA-Z0-9]*)");
    private static final Pattern ATTRIBUTE = Pattern.compile("([a-zA-Z_:][-a-zA-Z0-9_:.]*)\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s>]+)");
    private static final Pattern HEADING_TAG = Pattern.compile("h[1-6]");
    private static final Set<Kind> INLINE = EnumSet.of(
        Kind.ANCHOR_OPEN, Kind.ANCHOR_CLOSE, Kind.IMAGE, Kind.ITALIC_OPEN, Kind.ITALIC_CLOSE,
        Kind.BOLD_OPEN, Kind.BOLD_CLOSE, Kind.FONT_OPEN, Kind.FONT_CLOSE, Kind.COMMENT);

    private MarkupTokenizer() {}

    /**
     * Tokenizes a page. Never fails; null is treated as empty input.
     * @param html raw page markup
     * @return tokens in source order
     */
    public static List<MarkupToken> tokenize(String html) {
        List<MarkupToken> tokens = new ArrayList<>();
        if (html == null || html.isEmpty()) return tokens;
        int length = html.length();
        int textStart = 0;
        int i = 0;
        while (i < length) {
            if (html.charAt(i) != '<' || !startsTag(html, i)) {
                i++;
                continue;
            }
            int end;
            if (html.startsWith("<!--", i)) {
                int close = html.indexOf("-->", i + 4);
                end = close < 0 ? length : close + 3;
            } else {
                int close = html.indexOf('>', i + 1);
                if (close < 0) break;
                end = close + 1;
            }
            flushText(html, textStart, i, tokens);
            tokens.add(classify(html.substring(i, end)));
            i = end;
            textStart = end;
        }
        flushText(html, textStart, length, tokens);
        return tokens;
    }

    /**
     * Concatenates the text runs of a token span and collapses whitespace. Inline tags (anchors,
     * emphasis, fonts, images, comments) join their neighbours directly; any other tag is a word break.
     */
    public static String flattenText(List<MarkupToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (MarkupToken token : tokens) {
            if (token.is(Kind.TEXT)) {
                sb.append(token.value());
            } else if (!INLINE.contains(token.kind())) {
                sb.append(' ');
            }
        }
        return FieldSegmenter.normalizeWhitespace(sb.toString());
    }

    /**
     * Concatenates the raw source of a token span.
     */
    public static String toMarkup(List<MarkupToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (MarkupToken token : tokens) sb.append(token.raw());
        return sb.toString();
    }

    private static boolean startsTag(String html, int i) {
        if (i + 1 >= html.length()) return false;
        char next = html.charAt(i + 1);
        return Character.isLetter(next) || next == '/' || next == '!';
    }

    private static void flushText(String html, int start, int end, List<MarkupToken> tokens) {
        if (end <= start) return;
        String raw = html.substring(start, end);
        tokens.add(new MarkupToken(Kind.TEXT, raw, Parser.unescapeEntities(raw, false)));
    }

    private static MarkupToken classify(String raw) {
        if (raw.startsWith("<!")) {
            return new MarkupToken(Kind.COMMENT, raw, null);
        }
        String inner = raw.substring(1, raw.length() - 1).trim();
        boolean closing = inner.startsWith("/");
        Matcher nameMatch = TAG_NAME.matcher(inner);
        if (!nameMatch.find()) {
            return new MarkupToken(Kind.OTHER_TAG, raw, null);
        }
        String name = nameMatch.group(1).toLowerCase(Locale.ROOT);
        switch (name) {
            case "a":
                return closing
                    ? new MarkupToken(Kind.ANCHOR_CLOSE, raw, null)
                    : new MarkupToken(Kind.ANCHOR_OPEN, raw, attribute(inner, "name"));
            case "img":
                return new MarkupToken(Kind.IMAGE, raw, attribute(inner, "src"));
            case "i":
            case "em":
                return new MarkupToken(closing ? Kind.ITALIC_CLOSE : Kind.ITALIC_OPEN, raw, null);
            case "b":
            case "strong":
                return new MarkupToken(closing ? Kind.BOLD_CLOSE : Kind.BOLD_OPEN, raw, null);
            case "br":
                return new MarkupToken(Kind.LINE_BREAK, raw, null);
            case "font":
                return closing
                    ? new MarkupToken(Kind.FONT_CLOSE, raw, null)
                    : new MarkupToken(Kind.FONT_OPEN, raw, attribute(inner, "size"));
            case "p":
                return new MarkupToken(Kind.PARAGRAPH, raw, null);
            case "hr":
                return new MarkupToken(Kind.RULE, raw, null);
            default:
                if (HEADING_TAG.matcher(name).matches()) {
                    return new MarkupToken(Kind.HEADING, raw, null);
                }
                return new MarkupToken(Kind.OTHER_TAG, raw, null);
        }
    }

    // Case-insensitive attribute lookup; quotes are stripped from the value.
    private static String attribute(String inner, String attributeName) {
        Matcher m = ATTRIBUTE.matcher(inner);
        while (m.find()) {
            if (m.group(1).equalsIgnoreCase(attributeName)) {
                String value = m.group(2);
                if (value.length() >= 2 && (value.charAt(0) == '"' || value.charAt(0) == '\'')) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }
        return null;
    }
}
