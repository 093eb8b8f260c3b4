package com.historicforts.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FortPageParserTest {

    @Test
    void testParsePage() {
        List<FortRecord> records = FortPageParser.parsePage(Fixtures.page("connecticut.html"), Fixtures.CT_SOURCE);
        assertEquals(3, records.size());

        Map<String, Object> hill = records.get(0).toMap();
        assertEquals("Fort Hill", hill.get("name_primary"));
        assertEquals("Fort Trumbull Annex", hill.get("alt_names"));
        assertEquals("CT", hill.get("state_territory"));
        assertEquals("Connecticut", hill.get("state_full_name"));
        assertEquals("near New London", hill.get("location_text"));
        assertEquals("fort", hill.get("fort_type"));
        assertEquals("Great Britain|United States", hill.get("nationality"));
        assertEquals("(1775 - 1783)", hill.get("dates_raw"));
        assertEquals(1775, hill.get("earliest_year"));
        assertEquals(1783, hill.get("latest_year"));
        assertEquals(Fixtures.CT_URL, hill.get("source_url"));
        assertEquals("East", hill.get("source_section"));
        assertEquals("Fort Hill (1775 - 1783), near New London - A stone fort, also known as Fort Trumbull Annex. "
            + "Abandoned after the war.", hill.get("entry_raw"));

        FortRecord griswold = records.get(1);
        assertEquals("battery", griswold.entry().fortType());
        assertNull(griswold.toMap().get("location_text"));
        assertEquals(3, griswold.periods().size());
        assertEquals(1861, griswold.entry().latestYear());

        FortEntry saybrook = records.get(2).entry();
        assertEquals("Saybrook Fort", saybrook.namePrimary());
        assertEquals("(1636 - 1647)", saybrook.datesRaw());
        assertEquals("Old Saybrook", saybrook.locationText());
        assertEquals("stockade", saybrook.fortType());
    }

    @Test
    void testPlainTextPage() {
        List<FortEntry> entries = FortPageParser.parseEntries(Fixtures.page("plain-text.html"), "test");
        assertEquals(List.of("Fort Alpha", "Fort Beta"), entries.stream().map(FortEntry::namePrimary).toList());
        assertEquals("near Hartford", entries.get(0).locationText());
        assertEquals("stockade", entries.get(0).fortType());
        assertEquals(1760, entries.get(0).latestYear());
        assertEquals("Built by the French.", entries.get(1).descriptionRaw());
        assertEquals(List.of("France"), entries.get(1).nationalities());
    }

    @Test
    void testPlainTextLocationWithAbbreviation() {
        String html = "<html><body><p>Fort Alpha (1750), St. Louis</p><p>Fort Beta (1755), Mobile</p></body></html>";
        FortEntry alpha = FortPageParser.parseEntries(html, "test").get(0);
        assertEquals("St. Louis", alpha.locationText());
        assertEquals("", alpha.descriptionRaw());
        assertEquals("(1750)", alpha.datesRaw());
        assertEquals("Fort Alpha (1750), St. Louis", alpha.entryRaw());
    }

    @Test
    void testPageWithoutEntries() {
        assertTrue(FortPageParser.parseEntries(Fixtures.page("no-entries.html"), "test").isEmpty());
        assertTrue(FortPageParser.parseEntries(null, "test").isEmpty());
    }

    @Test
    void testParsingIsDeterministic() {
        String html = Fixtures.page("connecticut.html");
        assertEquals(FortPageParser.parseEntries(html, "a"), FortPageParser.parseEntries(html, "b"));
    }
}
