package com.historicforts.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Service for exporting fort records and their periods to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Creates the output directory on first use.</li>
 *   <li>Writes the fort rows with the same columns as the {@code forts} table.</li>
 *   <li>Writes the periods with the fort's name and state so that they can be joined back.</li>
 * </ul>
 * Values are written verbatim (UTF-8, quoted by OpenCSV); {@code null} becomes an empty cell.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    public static final List<String> PERIOD_COLUMNS = List.of(
        "name_primary", "state_territory", "start_year", "end_year", "period_type", "period_notes", "period_order"
    );

    private final Path outputDir;

    public CsvService(String outputDir) {
        this.outputDir = Paths.get(outputDir);
    }

    @Override
    public Path writeFortsToCsv(List<FortRecord> records, String filename) throws IOException {
        Path target = resolve(records, filename);
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8))) {
            writer.writeNext(FortRecord.COLUMNS.toArray(String[]::new));
            for (FortRecord record : records) {
                Map<String, Object> row = record.toMap();
                writer.writeNext(FortRecord.COLUMNS.stream().map(c -> cell(row.get(c))).toArray(String[]::new));
            }
        }
        logger.info("Wrote {} forts to CSV file: {}", records.size(), target);
        return target;
    }

    @Override
    public Path writePeriodsToCsv(List<FortRecord> records, String filename) throws IOException {
        Path target = resolve(records, filename);
        int rows = 0;
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8))) {
            writer.writeNext(PERIOD_COLUMNS.toArray(String[]::new));
            for (FortRecord record : records) {
                for (Period period : record.periods()) {
                    writer.writeNext(new String[]{
                        record.entry().namePrimary(),
                        cell(record.stateTerritory()),
                        cell(period.startYear()),
                        cell(period.endYear()),
                        period.periodType() == null ? "" : period.periodType().label(),
                        cell(period.periodNotes()),
                        Integer.toString(period.periodOrder())
                    });
                    rows++;
                }
            }
        }
        logger.info("Wrote {} periods to CSV file: {}", rows, target);
        return target;
    }

    private Path resolve(List<FortRecord> records, String filename) throws IOException {
        if (records == null) {
            logger.warn("Attempted to write null record list to CSV: {}", filename);
            throw new IllegalArgumentException("Record list cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        if (!Files.exists(outputDir)) Files.createDirectories(outputDir);
        return outputDir.resolve(filename);
    }

    private static String cell(Object value) {
        return value == null ? "" : value.toString();
    }
}
