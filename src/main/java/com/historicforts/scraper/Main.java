package com.historicforts.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Main entry point for the fort scraper.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code scrape [--force] [--limit N]} (default): discovers the state pages, scrapes them into
 *       PostgreSQL and then exports the database.</li>
 *   <li>{@code export}: writes every stored fort to {@code forts.csv} and its periods to
 *       {@code fort_periods.csv}.</li>
 *   <li>{@code test <url>}: parses one page and prints the first entries, storing nothing.</li>
 *   <li>{@code discover}: prints the discovered pages as JSON.</li>
 *   <li>{@code stats}: prints database statistics as JSON.</li>
 *   <li>{@code db}: starts the embedded database only, until Enter is pressed.</li>
 * </ul>
 * The database is the one named by {@code DB_URL}, or an embedded server when none is configured.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String FORTS_CSV = "forts.csv";
    static final String PERIODS_CSV = "fort_periods.csv";
    static final String DISCOVERED_JSON = "discovered_urls.json";
    private static final int TEST_PREVIEW = 10;

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Parsed command line.
     * @param limit maximum pages to scrape, 0 for all
     * @param url page to parse in {@code test} mode
     */
    record CliArgs(String mode, boolean force, int limit, String url) {}

    static CliArgs parseArgs(String[] args) {
        String mode = "scrape";
        boolean force = false;
        int limit = 0;
        String url = null;
        int i = 0;
        if (args != null && args.length > 0 && !args[0].startsWith("--")) {
            mode = args[0].trim().toLowerCase(Locale.ROOT);
            i = 1;
        }
        for (; args != null && i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--force")) {
                force = true;
            } else if (arg.equals("--limit")) {
                if (i + 1 >= args.length) throw new IllegalArgumentException("--limit requires a number");
                try {
                    limit = Integer.parseInt(args[++i]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid --limit value: " + args[i]);
                }
                if (limit < 0) throw new IllegalArgumentException("--limit must not be negative");
            } else if (mode.equals("test") && url == null) {
                url = arg;
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }
        if (!List.of("scrape", "test", "discover", "stats", "export", "db").contains(mode)) {
            throw new IllegalArgumentException("Unknown mode: " + mode);
        }
        if (mode.equals("test") && (url == null || url.isBlank())) {
            throw new IllegalArgumentException("test mode requires a URL");
        }
        return new CliArgs(mode, force, limit, url);
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        CliArgs cli;
        try {
            cli = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: scrape [--force] [--limit N] | test <url> | discover | stats | export | db");
            System.exit(2);
            return;
        }
        ScraperConfig config = ScraperConfig.load();
        FetchServiceInterface fetcher = new FetchService(config);

        switch (cli.mode()) {
            case "test" -> printTestPage(new ScraperService(fetcher, null, config), cli.url());
            case "discover" -> System.out.println(toJson(new DiscoveryService(fetcher, config).discoverAll()));
            default -> runWithDatabase(cli, config, fetcher);
        }
    }

    private static void runWithDatabase(CliArgs cli, ScraperConfig config, FetchServiceInterface fetcher) {
        EmbeddedPostgres postgres = null;
        try {
            String dbUrl = config.dbUrl();
            if (!config.hasExternalDatabase()) {
                postgres = PostgresService.startEmbedded(config.embeddedDbDataDir(), config.embeddedDbPort());
                dbUrl = PostgresService.embeddedJdbcUrl(postgres.getPort());
            }
            PostgresService store = new PostgresService(dbUrl, config.dbUser(), config.dbPassword());
            store.createTables();

            switch (cli.mode()) {
                case "stats" -> System.out.println(toJson(store.getStats()));
                case "export" -> exportCsv(store, new CsvService(config.outputDir()));
                case "db" -> waitForEnter(dbUrl, config);
                default -> scrapeAndExport(cli, config, fetcher, store);
            }
        } catch (RuntimeException e) {
            logger.error("Failed to start database or run scraper: {}", e.getMessage());
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
    }

    private static void scrapeAndExport(CliArgs cli, ScraperConfig config, FetchServiceInterface fetcher,
                                        PostgresServiceInterface store) {
        List<PageInfo> pages = new DiscoveryService(fetcher, config).discoverAll();
        if (pages.isEmpty()) {
            logger.warn("No state pages discovered, nothing to scrape.");
            return;
        }
        saveDiscovered(pages, config.outputDir());

        ScraperServiceInterface scraper = new ScraperService(fetcher, store, config);
        scraper.scrapeAll(pages, cli.force(), cli.limit());

        exportCsv(store, new CsvService(config.outputDir()));

        Map<String, Object> stats = store.getStats();
        logger.info("Database statistics: {}", stats);
    }

    /**
     * Writes all stored forts and their periods, so pages skipped by an incremental scrape stay in the files.
     * Nothing is written when the database holds no forts.
     * @return number of forts written, or -1 if the files could not be written
     */
    static int exportCsv(PostgresServiceInterface store, CsvServiceInterface csv) {
        List<FortRecord> records = store.getAllForts();
        if (records.isEmpty()) {
            logger.warn("No forts in the database, leaving existing CSV files untouched.");
            return 0;
        }
        try {
            csv.writeFortsToCsv(records, FORTS_CSV);
            csv.writePeriodsToCsv(records, PERIODS_CSV);
            return records.size();
        } catch (IOException e) {
            logger.error("Failed to write CSV export: {}", e.getMessage());
            return -1;
        }
    }

    private static void saveDiscovered(List<PageInfo> pages, String outputDir) {
        try {
            Path dir = Paths.get(outputDir);
            if (!Files.exists(dir)) Files.createDirectories(dir);
            MAPPER.writeValue(dir.resolve(DISCOVERED_JSON).toFile(), pages);
        } catch (IOException e) {
            logger.warn("Failed to save discovered URLs: {}", e.getMessage());
        }
    }

    private static void printTestPage(ScraperServiceInterface scraper, String url) {
        List<FortEntry> entries = scraper.testPage(url);
        System.out.printf("Found %d entries on %s%n%n", entries.size(), url);
        for (int i = 0; i < Math.min(TEST_PREVIEW, entries.size()); i++) {
            FortEntry entry = entries.get(i);
            System.out.printf("%d. %s%n", i + 1, entry.namePrimary());
            System.out.printf("   Dates: %s%n", entry.datesRaw());
            System.out.printf("   Location: %s%n", entry.locationText());
            System.out.printf("   Periods: %s%n", entry.periods());
            System.out.printf("   Nationalities: %s%n", entry.nationalities());
            System.out.printf("   Type: %s%n%n", entry.fortType());
        }
        if (entries.size() > TEST_PREVIEW) {
            System.out.printf("... and %d more entries%n", entries.size() - TEST_PREVIEW);
        }
    }

    private static void waitForEnter(String dbUrl, ScraperConfig config) {
        System.out.println("Database ready.");
        System.out.println("JDBC URL: " + dbUrl);
        System.out.println("DB user: " + config.dbUser());
        System.out.println("Press Enter to stop and exit.");
        try {
            System.in.read();
        } catch (IOException e) {
            logger.warn("Failed to read from stdin: {}", e.getMessage());
        }
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialise output: {}", e.getMessage());
            return "{}";
        }
    }
}
