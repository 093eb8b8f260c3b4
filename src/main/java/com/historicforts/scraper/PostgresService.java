package com.historicforts.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Service for storing fort records, their periods and the scrape log in PostgreSQL.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #createTables()} creates the schema idempotently.</li>
 *   <li>{@link #insertFort(FortRecord)} upserts on (name_primary, state_territory, source_url), then
 *       deletes and re-inserts the fort's periods in the same transaction, so re-scraping a page
 *       never duplicates rows.</li>
 *   <li>{@link #logScrape} keeps one row per URL; {@link #getScrapeStatus} lets a scrape skip pages
 *       that already succeeded.</li>
 *   <li>{@link #getAllForts()} reads the whole table back for export.</li>
 * </ul>
 * SQL errors are logged and reported as -1, null or empty results.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
@SuppressWarnings("SqlResolve")
public class PostgresService implements PostgresServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);
    private final String url;
    private final String user;
    private final String password;

    private static final String FORT_COLUMNS = String.join(", ", FortRecord.COLUMNS);

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void createTables() {
        String fortTable = "CREATE TABLE IF NOT EXISTS forts (" +
                "id SERIAL PRIMARY KEY, " +
                "name_primary TEXT NOT NULL, alt_names TEXT, " +
                "state_territory TEXT NOT NULL, state_full_name TEXT, location_text TEXT, " +
                "fort_type TEXT, nationality TEXT, dates_raw TEXT, " +
                "earliest_year INTEGER, latest_year INTEGER, " +
                "source_url TEXT, source_section TEXT, " +
                "description_raw TEXT, entry_raw TEXT, " +
                "scraped_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, " +
                "UNIQUE (name_primary, state_territory, source_url)" +
                ")";
        String periodTable = "CREATE TABLE IF NOT EXISTS fort_periods (" +
                "id SERIAL PRIMARY KEY, " +
                "fort_id INTEGER NOT NULL REFERENCES forts(id) ON DELETE CASCADE, " +
                "start_year INTEGER, end_year INTEGER, " +
                "period_type TEXT, period_notes TEXT, period_order INTEGER DEFAULT 0" +
                ")";
        String logTable = "CREATE TABLE IF NOT EXISTS scrape_log (" +
                "id SERIAL PRIMARY KEY, " +
                "url TEXT NOT NULL UNIQUE, " +
                "status TEXT DEFAULT 'pending', forts_found INTEGER DEFAULT 0, " +
                "error_message TEXT, scraped_at TIMESTAMP" +
                ")";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(fortTable);
            stmt.execute(periodTable);
            stmt.execute(logTable);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_forts_state ON forts(state_territory)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_forts_years ON forts(earliest_year, latest_year)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_periods_fort ON fort_periods(fort_id)");
            logger.info("Ensured forts, fort_periods and scrape_log tables exist.");
        } catch (SQLException e) {
            logger.error("Error creating tables: {}", e.getMessage());
        }
    }

    @Override
    public int insertFort(FortRecord record) {
        if (record == null || record.stateTerritory() == null || record.stateTerritory().isBlank()) {
            logger.warn("Invalid fort record for DB insert: {}", record);
            return -1;
        }
        StringBuilder updates = new StringBuilder();
        for (String column : FortRecord.COLUMNS.subList(1, FortRecord.COLUMNS.size())) {
            if (column.equals("state_territory") || column.equals("source_url")) continue;
            updates.append(column).append(" = EXCLUDED.").append(column).append(", ");
        }
        String sql = "INSERT INTO forts (" + FORT_COLUMNS + ") VALUES (" +
                "?, ".repeat(FortRecord.COLUMNS.size() - 1) + "?) " +
                "ON CONFLICT (name_primary, state_territory, source_url) DO UPDATE SET " +
                updates + "scraped_at = CURRENT_TIMESTAMP RETURNING id";
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                Map<String, Object> row = record.toMap();
                int index = 1;
                for (String column : FortRecord.COLUMNS) {
                    Object value = row.get(column);
                    if (value == null) {
                        ps.setNull(index, column.endsWith("_year") ? Types.INTEGER : Types.VARCHAR);
                    } else {
                        ps.setObject(index, value);
                    }
                    index++;
                }
                int fortId = -1;
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) fortId = rs.getInt(1);
                }
                if (fortId <= 0) {
                    conn.rollback();
                    logger.error("Upsert of fort '{}' returned no id", record.entry().namePrimary());
                    return -1;
                }
                try (PreparedStatement delete = conn.prepareStatement("DELETE FROM fort_periods WHERE fort_id = ?")) {
                    delete.setInt(1, fortId);
                    delete.executeUpdate();
                }
                insertPeriods(conn, fortId, record.periods());
                conn.commit();
                logger.debug("Inserted/updated fort '{}' (id={})", record.entry().namePrimary(), fortId);
                return fortId;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            logger.error("Error inserting fort '{}': {}", record.entry().namePrimary(), e.getMessage());
        }
        return -1;
    }

    @Override
    public void insertPeriods(int fortId, List<Period> periods) {
        if (fortId <= 0 || periods == null || periods.isEmpty()) {
            logger.warn("Invalid fortId or empty period list for DB insert: fortId={}, periods={}", fortId, periods == null ? null : periods.size());
            return;
        }
        try (Connection conn = connect()) {
            insertPeriods(conn, fortId, periods);
        } catch (SQLException e) {
            logger.error("Error inserting periods for fort {}: {}", fortId, e.getMessage());
        }
    }

    private static void insertPeriods(Connection conn, int fortId, List<Period> periods) throws SQLException {
        if (periods.isEmpty()) return;
        String sql = "INSERT INTO fort_periods (fort_id, start_year, end_year, period_type, period_notes, period_order) " +
                "VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (Period period : periods) {
                ps.setInt(1, fortId);
                if (period.startYear() != null) ps.setInt(2, period.startYear()); else ps.setNull(2, Types.INTEGER);
                if (period.endYear() != null) ps.setInt(3, period.endYear()); else ps.setNull(3, Types.INTEGER);
                ps.setString(4, period.periodType() == null ? null : period.periodType().label());
                ps.setString(5, period.periodNotes());
                ps.setInt(6, period.periodOrder());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public void logScrape(String url, String status, int fortsFound, String errorMessage) {
        if (url == null || url.isBlank()) {
            logger.warn("Refusing to log scrape for blank URL");
            return;
        }
        String sql = "INSERT INTO scrape_log (url, status, forts_found, error_message, scraped_at) VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP) " +
                "ON CONFLICT (url) DO UPDATE SET status = EXCLUDED.status, forts_found = EXCLUDED.forts_found, " +
                "error_message = EXCLUDED.error_message, scraped_at = EXCLUDED.scraped_at";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, url);
            ps.setString(2, status);
            ps.setInt(3, fortsFound);
            ps.setString(4, errorMessage);
            ps.executeUpdate();
        } catch (SQLException e) {
            logger.error("Error logging scrape of {}: {}", url, e.getMessage());
        }
    }

    @Override
    public ScrapeLogEntry getScrapeStatus(String url) {
        String sql = "SELECT url, status, forts_found, error_message, scraped_at FROM scrape_log WHERE url = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, url);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    Timestamp scrapedAt = rs.getTimestamp("scraped_at");
                    return new ScrapeLogEntry(rs.getString("url"), rs.getString("status"), rs.getInt("forts_found"),
                        rs.getString("error_message"), scrapedAt == null ? null : scrapedAt.toLocalDateTime());
                }
            }
        } catch (SQLException e) {
            logger.error("Error reading scrape status of {}: {}", url, e.getMessage());
        }
        return null;
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stats.put("total_forts", count(stmt, "SELECT COUNT(*) FROM forts"));
            stats.put("total_periods", count(stmt, "SELECT COUNT(*) FROM fort_periods"));
            stats.put("pages_scraped", count(stmt, "SELECT COUNT(*) FROM scrape_log WHERE status = '" + ScrapeLogEntry.SUCCESS + "'"));
            Map<String, Integer> byState = new LinkedHashMap<>();
            try (ResultSet rs = stmt.executeQuery(
                    "SELECT state_territory, COUNT(*) AS count FROM forts GROUP BY state_territory ORDER BY count DESC, state_territory")) {
                while (rs.next()) byState.put(rs.getString(1), rs.getInt(2));
            }
            stats.put("forts_by_state", byState);
        } catch (SQLException e) {
            logger.error("Error reading database statistics: {}", e.getMessage());
        }
        return stats;
    }

    @Override
    public List<FortRecord> getAllForts() {
        String fortSql = "SELECT id, " + FORT_COLUMNS + " FROM forts ORDER BY state_territory, name_primary, id";
        String periodSql = "SELECT fort_id, start_year, end_year, period_type, period_notes, period_order " +
                "FROM fort_periods ORDER BY fort_id, period_order, id";
        List<FortRecord> records = new ArrayList<>();
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            Map<Integer, List<Period>> periodsByFort = new HashMap<>();
            try (ResultSet rs = stmt.executeQuery(periodSql)) {
                while (rs.next()) {
                    Period period = new Period(nullableInt(rs, "start_year"), nullableInt(rs, "end_year"),
                        rs.getString("period_notes"), rs.getInt("period_order"),
                        PeriodType.fromLabel(rs.getString("period_type")));
                    periodsByFort.computeIfAbsent(rs.getInt("fort_id"), id -> new ArrayList<>()).add(period);
                }
            }
            try (ResultSet rs = stmt.executeQuery(fortSql)) {
                while (rs.next()) {
                    records.add(toRecord(rs, periodsByFort.getOrDefault(rs.getInt("id"), List.of())));
                }
            }
            logger.info("Read {} forts from the database.", records.size());
        } catch (SQLException e) {
            logger.error("Error reading forts: {}", e.getMessage());
            return List.of();
        }
        return records;
    }

    private static FortRecord toRecord(ResultSet rs, List<Period> periods) throws SQLException {
        FortEntry entry = new FortEntry(
            rs.getString("name_primary"),
            rs.getString("dates_raw"),
            rs.getString("location_text"),
            rs.getString("description_raw"),
            rs.getString("entry_raw"),
            splitList(rs.getString("alt_names")),
            splitList(rs.getString("nationality")),
            periods,
            nullableInt(rs, "earliest_year"),
            nullableInt(rs, "latest_year"),
            rs.getString("fort_type")
        );
        PageSource source = new PageSource(rs.getString("source_url"), rs.getString("state_territory"),
            rs.getString("state_full_name"), rs.getString("source_section"));
        return new FortRecord(entry, source);
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static List<String> splitList(String joined) {
        if (joined == null || joined.isEmpty()) return List.of();
        return List.of(joined.split(Pattern.quote(FortRecord.LIST_DELIMITER)));
    }

    private static int count(Statement stmt, String sql) throws SQLException {
        try (ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new RuntimeException(e);
        }
    }

    /**
     * JDBC URL of the default database of an embedded server on the given port.
     */
    public static String embeddedJdbcUrl(int port) {
        return String.format("jdbc:postgresql://localhost:%d/postgres", port);
    }
}
