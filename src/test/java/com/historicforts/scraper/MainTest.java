package com.historicforts.scraper;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    Path tempDir;

    private static List<String[]> read(Path file) throws Exception {
        try (CSVReader reader = new CSVReader(Files.newBufferedReader(file, StandardCharsets.UTF_8))) {
            return reader.readAll();
        }
    }

    @Test
    void testDefaultModeIsScrape() {
        Main.CliArgs args = Main.parseArgs(new String[0]);
        assertEquals("scrape", args.mode());
        assertFalse(args.force());
        assertEquals(0, args.limit());
    }

    @Test
    void testScrapeOptions() {
        Main.CliArgs args = Main.parseArgs(new String[]{"--force", "--limit", "5"});
        assertEquals("scrape", args.mode());
        assertTrue(args.force());
        assertEquals(5, args.limit());

        assertEquals(2, Main.parseArgs(new String[]{"SCRAPE", "--limit", "2"}).limit());
    }

    @Test
    void testOtherModes() {
        Main.CliArgs test = Main.parseArgs(new String[]{"test", "https://example.org/East/ct.html"});
        assertEquals("test", test.mode());
        assertEquals("https://example.org/East/ct.html", test.url());
        assertEquals("stats", Main.parseArgs(new String[]{"stats"}).mode());
        assertEquals("discover", Main.parseArgs(new String[]{"discover"}).mode());
        assertEquals("db", Main.parseArgs(new String[]{"db"}).mode());
        assertEquals("export", Main.parseArgs(new String[]{"export"}).mode());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"dump"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"export", "--force", "x"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"--limit", "many"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"--limit"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"--limit", "-1"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"test"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"stats", "extra"}));
    }

    @Test
    void testJsonOutput() {
        String json = Main.toJson(Map.of("total_forts", 3));
        assertTrue(json.contains("\"total_forts\" : 3"));
    }

    @Test
    void testExportWritesAllStoredForts() throws Exception {
        ScraperServiceTest.InMemoryStore store = new ScraperServiceTest.InMemoryStore();
        store.insertFort(Fixtures.record("Fort Hill", "(1775, 1812 - 1815)", "ct"));
        store.insertFort(Fixtures.record("Fort Ross", "(1812)", "ca"));

        assertEquals(2, Main.exportCsv(store, new CsvService(tempDir.toString())));

        List<String[]> forts = read(tempDir.resolve(Main.FORTS_CSV));
        assertEquals(3, forts.size());
        assertEquals("Fort Hill", forts.get(1)[0]);
        assertEquals("Fort Ross", forts.get(2)[0]);
        assertEquals(4, read(tempDir.resolve(Main.PERIODS_CSV)).size());
    }

    @Test
    void testExportLeavesFilesWhenDatabaseEmpty() throws Exception {
        Path forts = tempDir.resolve(Main.FORTS_CSV);
        Files.writeString(forts, "earlier export\n");

        assertEquals(0, Main.exportCsv(new ScraperServiceTest.InMemoryStore(), new CsvService(tempDir.toString())));
        assertEquals("earlier export\n", Files.readString(forts));
        assertFalse(Files.exists(tempDir.resolve(Main.PERIODS_CSV)));
    }
}
