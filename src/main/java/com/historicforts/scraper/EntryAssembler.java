package com.historicforts.scraper;

import java.util.List;

/**
 * Builds one {@link FortEntry} per {@link EntryFragment} and adapts entries to the storage shape.
 * <p>
 * Segmented fragments are used as they are; unsegmented ones go through {@link FieldSegmenter}
 * first. Alternate names come from the description markup when the fragment has it, otherwise from
 * the plain description. The fort type is classified from the cleaned name and the description.
 */
public final class EntryAssembler {

    private EntryAssembler() {}

    /**
     * @param fragment extracted fragment
     * @return immutable entry with a non-empty name
     */
    public static FortEntry assemble(EntryFragment fragment) {
        if (fragment.segmented()) {
            String name = FieldSegmenter.cleanName(fragment.name());
            String dates = fragment.datesRaw().trim();
            String description = fragment.descriptionText();
            List<String> altNames = fragment.descriptionHtml().isEmpty()
                ? AltNameExtractor.fromText(description)
                : AltNameExtractor.fromHtml(fragment.descriptionHtml());
            ParsedDates parsed = DateRangeParser.parse(dates);
            return new FortEntry(
                name,
                dates.isEmpty() ? "" : "(" + dates + ")",
                fragment.locationText(),
                description,
                summarize(name, dates, fragment.locationText(), description),
                altNames,
                fragment.nationalities(),
                parsed.periods(),
                parsed.earliestYear(),
                parsed.latestYear(),
                FortTypeClassifier.classify(name, description)
            );
        }

        FieldSegmenter.Segments segments = FieldSegmenter.segment(fragment.rawText());
        if (!segments.parsed()) {
            return rawTextEntry(segments, fragment.nationalities());
        }
        ParsedDates parsed = DateRangeParser.parse(segments.datesRaw());
        return new FortEntry(
            segments.name(),
            segments.datesRaw(),
            segments.locationText(),
            segments.descriptionRaw(),
            segments.entryRaw(),
            AltNameExtractor.fromText(segments.descriptionRaw()),
            fragment.nationalities(),
            parsed.periods(),
            parsed.earliestYear(),
            parsed.latestYear(),
            FortTypeClassifier.classify(segments.name(), segments.descriptionRaw())
        );
    }

    /**
     * Entry for text whose layout was not recognised: name from the first 100 characters, the full
     * text kept as description and entryRaw, no dates or alternate names.
     */
    public static FortEntry rawTextEntry(String text, List<String> nationalities) {
        String raw = text == null ? "" : text;
        String name = FieldSegmenter.fallbackName(raw);
        return new FortEntry(name, "", "", raw, raw, List.of(), nationalities, List.of(), null, null,
            FortTypeClassifier.classify(name, raw));
    }

    private static FortEntry rawTextEntry(FieldSegmenter.Segments segments, List<String> nationalities) {
        return new FortEntry(segments.name(), "", "", segments.descriptionRaw(), segments.entryRaw(), List.of(),
            nationalities, List.of(), null, null, FortTypeClassifier.classify(segments.name(), segments.descriptionRaw()));
    }

    /**
     * Adapts an entry to the storage shape for the page it came from.
     */
    public static FortRecord toRecord(FortEntry entry, PageSource source) {
        return new FortRecord(entry, source);
    }

    /**
     * One-line summary "Name (dates), location - description" used as entryRaw; empty parts are left out.
     */
    public static String summarize(String name, String dates, String location, String description) {
        StringBuilder sb = new StringBuilder(name);
        if (!dates.isEmpty()) sb.append(" (").append(dates).append(')');
        if (!location.isEmpty()) sb.append(", ").append(location);
        if (!description.isEmpty()) sb.append(location.isEmpty() ? " " : " - ").append(description);
        return sb.toString();
    }
}
