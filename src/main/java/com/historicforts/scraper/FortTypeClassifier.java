package com.historicforts.scraper;

import java.util.List;
import java.util.Locale;

/**
 * Assigns a fortification type from keywords in the name and description.
 * <p>
 * The keyword table is evaluated top to bottom and the first hit wins, so specific types sit above
 * the generic "camp " and "fort " catch-alls ("Fort Blockhouse" is a blockhouse, not a fort).
 * Trailing spaces in "camp " and "fort " keep "campaign" and "fortune" from matching.
 */
public final class FortTypeClassifier {

    public static final String DEFAULT_TYPE = "fort";

    private record TypeRule(String type, List<String> keywords) {}

    private static final List<TypeRule> RULES = List.of(
        new TypeRule("battery", List.of("battery", "batteries")),
        new TypeRule("redoubt", List.of("redoubt")),
        new TypeRule("blockhouse", List.of("blockhouse", "block house", "block-house")),
        new TypeRule("stockade", List.of("stockade", "palisade")),
        new TypeRule("camp", List.of("camp ")),
        new TypeRule("cantonment", List.of("cantonment")),
        new TypeRule("barracks", List.of("barracks")),
        new TypeRule("arsenal", List.of("arsenal")),
        new TypeRule("trading post", List.of("trading post", "fur trading", "trading house")),
        new TypeRule("garrison", List.of("garrison house", "garrison")),
        new TypeRule("powder house", List.of("powder house", "magazine")),
        new TypeRule("fort", List.of("fort "))
    );

    private FortTypeClassifier() {}

    /**
     * @param name fort name (may be null)
     * @param description description text (may be null)
     * @return the first matching type label, or {@value #DEFAULT_TYPE}
     */
    public static String classify(String name, String description) {
        String text = ((name == null ? "" : name) + " " + (description == null ? "" : description)).toLowerCase(Locale.ROOT);
        for (TypeRule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (text.contains(keyword)) return rule.type();
            }
        }
        return DEFAULT_TYPE;
    }
}
