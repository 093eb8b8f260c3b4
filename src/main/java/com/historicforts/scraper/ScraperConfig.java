package com.historicforts.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings for the collaborators around the parser (fetching, discovery, storage, export).
 * <p>
 * Each setting is read from an environment variable, then a Java system property of the same name,
 * then a default. Numeric values that fail to parse fall back to the default with a warning.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public record ScraperConfig(
    String baseUrl,
    List<String> sections,
    long requestDelayMs,
    int requestTimeoutSeconds,
    String userAgent,
    int maxRetries,
    String dbUrl,
    String dbUser,
    String dbPassword,
    int embeddedDbPort,
    String embeddedDbDataDir,
    String outputDir
) {
    private static final Logger logger = LoggerFactory.getLogger(ScraperConfig.class);

    public static final String DEFAULT_BASE_URL = "https://www.northamericanforts.com";
    public static final String DEFAULT_USER_AGENT = "FortsScraper/1.0 (Educational research project)";

    public ScraperConfig {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    /**
     * Builds the configuration from environment variables and system properties.
     */
    public static ScraperConfig load() {
        return new ScraperConfig(
            stripTrailingSlash(envOrProp("FORTS_BASE_URL", DEFAULT_BASE_URL)),
            splitList(envOrProp("FORTS_SECTIONS", "East,West")),
            parseLong("FORTS_REQUEST_DELAY_MS", 1000L),
            parseInt("FORTS_REQUEST_TIMEOUT_SECONDS", 30),
            envOrProp("FORTS_USER_AGENT", DEFAULT_USER_AGENT),
            parseInt("FORTS_MAX_RETRIES", 3),
            envOrProp("DB_URL", ""),
            envOrProp("DB_USER", "postgres"),
            envOrProp("DB_PASS", "postgres"),
            parseInt("EMBEDDED_PG_PORT", 5432),
            envOrProp("EMBEDDED_PG_DATA_DIR", "scraped-data/pgdata"),
            envOrProp("FORTS_OUTPUT_DIR", "scraped-data")
        );
    }

    /**
     * True when an external database URL is configured; otherwise the embedded server is used.
     */
    public boolean hasExternalDatabase() {
        return dbUrl != null && !dbUrl.isBlank();
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    private static int parseInt(String key, int defaultVal) {
        String raw = envOrProp(key, Integer.toString(defaultVal));
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}: '{}', using {}", key, raw, defaultVal);
            return defaultVal;
        }
    }

    private static long parseLong(String key, long defaultVal) {
        String raw = envOrProp(key, Long.toString(defaultVal));
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid number for {}: '{}', using {}", key, raw, defaultVal);
            return defaultVal;
        }
    }

    private static List<String> splitList(String raw) {
        List<String> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) values.add(part.trim());
        }
        return values;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
