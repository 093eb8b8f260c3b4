package com.historicforts.scraper;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {

    @TempDir
    Path tempDir;

    private static List<String[]> read(Path file) throws Exception {
        try (CSVReader reader = new CSVReader(Files.newBufferedReader(file, StandardCharsets.UTF_8))) {
            return reader.readAll();
        }
    }

    @Test
    void testWriteFortsToCsv() throws Exception {
        CsvService csvService = new CsvService(tempDir.resolve("out").toString());
        List<FortRecord> records = List.of(
            Fixtures.record("Fort Hill", "(1775 - 1783)", "ct"),
            Fixtures.record("Fort Ross", "(1812)", "ca"));
        Path file = csvService.writeFortsToCsv(records, "forts.csv");

        assertEquals(tempDir.resolve("out").resolve("forts.csv"), file);
        List<String[]> rows = read(file);
        assertEquals(3, rows.size());
        assertArrayEquals(FortRecord.COLUMNS.toArray(String[]::new), rows.get(0));
        assertEquals("Fort Hill", rows.get(1)[0]);
        assertEquals("", rows.get(1)[1]);
        assertEquals("CT", rows.get(1)[2]);
        assertEquals("A post, with a comma.", rows.get(1)[FortRecord.COLUMNS.indexOf("description_raw")]);
        assertEquals("California", rows.get(2)[3]);
    }

    @Test
    void testWritePeriodsToCsv() throws Exception {
        CsvService csvService = new CsvService(tempDir.toString());
        List<FortRecord> records = List.of(
            Fixtures.record("Fort Hill", "(1775, 1845/1854)", "ct"),
            Fixtures.record("Fort Ross", "(1812 - 1841)", "ca"));
        List<String[]> rows = read(csvService.writePeriodsToCsv(records, "fort_periods.csv"));

        assertEquals(4, rows.size());
        assertArrayEquals(CsvService.PERIOD_COLUMNS.toArray(String[]::new), rows.get(0));
        assertArrayEquals(new String[]{"Fort Hill", "CT", "1775", "", "single_year", "", "0"}, rows.get(1));
        assertArrayEquals(new String[]{"Fort Hill", "CT", "", "1854", "ambiguous", "Ambiguous: 1845/1854", "1"}, rows.get(2));
        assertArrayEquals(new String[]{"Fort Ross", "CA", "1812", "1841", "range", "", "0"}, rows.get(3));
    }

    @Test
    void testInvalidArguments() {
        CsvService csvService = new CsvService(tempDir.toString());
        assertThrows(IllegalArgumentException.class, () -> csvService.writeFortsToCsv(null, "forts.csv"));
        assertThrows(IllegalArgumentException.class, () -> csvService.writePeriodsToCsv(List.of(), " "));
    }
}
