package com.historicforts.scraper;

/**
 * One span of page markup as produced by {@link MarkupTokenizer}.
 * <p>
 * {@code raw} is the exact source slice, so concatenating the raw values of consecutive tokens
 * reproduces that part of the page. {@code value} depends on the kind: the decoded text of a
 * {@link Kind#TEXT} run, the {@code NAME} attribute of an anchor, the {@code SRC} of an image, the
 * {@code SIZE} of a font tag; otherwise null.
 */
public record MarkupToken(Kind kind, String raw, String value) {

    public enum Kind {
        TEXT,
        ANCHOR_OPEN,
        ANCHOR_CLOSE,
        IMAGE,
        ITALIC_OPEN,
        ITALIC_CLOSE,
        BOLD_OPEN,
        BOLD_CLOSE,
        LINE_BREAK,
        FONT_OPEN,
        FONT_CLOSE,
        PARAGRAPH,
        RULE,
        HEADING,
        COMMENT,
        OTHER_TAG
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    /** True for a text run holding only whitespace. */
    public boolean isBlankText() {
        return kind == Kind.TEXT && (value == null || value.isBlank());
    }

    /** True for {@code <A NAME=...>}; plain links are anchors without a name. */
    public boolean isNamedAnchor() {
        return kind == Kind.ANCHOR_OPEN && value != null && !value.isBlank();
    }

    /**
     * True for tokens that end an entry's description: a named anchor, a paragraph tag, a rule,
     * a heading tag, or a sized font tag (older pages use those as section headings).
     */
    public boolean isEntryBoundary() {
        return switch (kind) {
            case PARAGRAPH, RULE, HEADING -> true;
            case ANCHOR_OPEN -> isNamedAnchor();
            case FONT_OPEN -> value != null;
            default -> false;
        };
    }
}
