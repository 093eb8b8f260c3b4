package com.historicforts.scraper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps flag-image references (e.g. {@code <img src="britishflag.gif">}) to nation labels via
 * {@link FortVocabulary}. Order-preserving and de-duplicated; unknown flags are skipped.
 */
public final class NationalityExtractor {
    private static final Pattern FLAG_IMAGE = Pattern.compile("([a-z]+flag\\d*)\\.(?:gif|png|jpe?g)", Pattern.CASE_INSENSITIVE);

    private NationalityExtractor() {}

    /**
     * @param htmlFragment markup holding image references (may be null)
     * @return nation labels in first-seen order
     */
    public static List<String> extract(String htmlFragment) {
        if (htmlFragment == null || htmlFragment.isEmpty()) return List.of();
        Set<String> nationalities = new LinkedHashSet<>();
        Matcher m = FLAG_IMAGE.matcher(htmlFragment);
        while (m.find()) {
            String nationality = FortVocabulary.nationalityForFlag(m.group(1).toLowerCase(Locale.ROOT));
            if (nationality != null) nationalities.add(nationality);
        }
        return new ArrayList<>(nationalities);
    }
}
