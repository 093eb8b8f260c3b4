package com.historicforts.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Central registry of the curated lookup tables used by the parser and the discovery step.
 * <p>
 * Both tables are JSON classpath resources read once when the class is initialised and exposed as
 * unmodifiable maps:
 * <ul>
 *   <li>{@code vocabulary/flag-nationalities.json}: lower-case flag token to nation label. This is an
 *       allow-list; flag images missing from it are ignored by {@link NationalityExtractor}.</li>
 *   <li>{@code vocabulary/state-names.json}: two-letter state code to full state name.</li>
 * </ul>
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public final class FortVocabulary {
    private static final Logger logger = LoggerFactory.getLogger(FortVocabulary.class);

    private static final String FLAGS_RESOURCE = "/vocabulary/flag-nationalities.json";
    private static final String STATES_RESOURCE = "/vocabulary/state-names.json";

    private static final Map<String, String> FLAG_NATIONALITY = load(FLAGS_RESOURCE);
    private static final Map<String, String> STATE_NAMES = load(STATES_RESOURCE);

    private FortVocabulary() {}

    /**
     * Returns the nation label for a flag token, or null if the token is not curated.
     * @param flagToken lower-case image base name, e.g. {@code britishflag}
     */
    public static String nationalityForFlag(String flagToken) {
        return flagToken == null ? null : FLAG_NATIONALITY.get(flagToken.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the full state name for a two-letter code, or null if unknown.
     */
    public static String stateName(String stateCode) {
        return stateCode == null ? null : STATE_NAMES.get(stateCode.toLowerCase(Locale.ROOT));
    }

    public static Map<String, String> flagNationalities() {
        return FLAG_NATIONALITY;
    }

    public static Map<String, String> stateNames() {
        return STATE_NAMES;
    }

    private static Map<String, String> load(String resource) {
        try (InputStream in = FortVocabulary.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + resource);
            }
            Map<String, String> map = new ObjectMapper().readValue(in, new TypeReference<LinkedHashMap<String, String>>() {});
            logger.debug("Loaded {} vocabulary entries from {}", map.size(), resource);
            return Collections.unmodifiableMap(map);
        } catch (IOException e) {
            logger.error("Failed to load vocabulary {}: {}", resource, e.getMessage());
            throw new RuntimeException(e);
        }
    }
}
