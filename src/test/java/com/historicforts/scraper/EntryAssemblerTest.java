package com.historicforts.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EntryAssemblerTest {

    @Test
    void testSegmentedFragment() {
        EntryFragment fragment = EntryFragment.segmented("Fort [1] Hill*", "1775 - 1783", "near New London",
            "A stone fort.", "", List.of("Great Britain"));
        FortEntry entry = EntryAssembler.assemble(fragment);
        assertEquals("Fort Hill", entry.namePrimary());
        assertEquals("(1775 - 1783)", entry.datesRaw());
        assertEquals("near New London", entry.locationText());
        assertEquals("Fort Hill (1775 - 1783), near New London - A stone fort.", entry.entryRaw());
        assertEquals(List.of(new Period(1775, 1783, null, 0, PeriodType.RANGE)), entry.periods());
        assertEquals(1775, entry.earliestYear());
        assertEquals(1783, entry.latestYear());
        assertEquals(List.of("Great Britain"), entry.nationalities());
        assertEquals("fort", entry.fortType());
    }

    @Test
    void testAltNamesFromPlainDescription() {
        EntryFragment fragment = EntryFragment.segmented("Fort Hill", "1775", "", "Renamed **Fort Adams** in 1790.", "", null);
        assertEquals(List.of("Fort Adams"), EntryAssembler.assemble(fragment).altNames());
    }

    @Test
    void testAltNamesFromDescriptionMarkup() {
        EntryFragment fragment = EntryFragment.segmented("Fort Hill", "1775", "", "Later Fort Adams.",
            "Later <b>Fort Adams</b>.", null);
        assertEquals(List.of("Fort Adams"), EntryAssembler.assemble(fragment).altNames());
    }

    @Test
    void testSegmentedFragmentWithoutDates() {
        FortEntry entry = EntryAssembler.assemble(EntryFragment.segmented("Fort Nowhere", "", "Somewhere", "", "", null));
        assertEquals("", entry.datesRaw());
        assertTrue(entry.periods().isEmpty());
        assertNull(entry.earliestYear());
        assertEquals("Fort Nowhere, Somewhere", entry.entryRaw());
    }

    @Test
    void testUnsegmentedFragment() {
        String text = "Fort X (1812), Near Boston - A small post.";
        FortEntry entry = EntryAssembler.assemble(EntryFragment.unsegmented(text, List.of("United States")));
        assertEquals("Fort X", entry.namePrimary());
        assertEquals("(1812)", entry.datesRaw());
        assertEquals("Near Boston", entry.locationText());
        assertEquals("A small post.", entry.descriptionRaw());
        assertEquals(text, entry.entryRaw());
        assertEquals(1812, entry.earliestYear());
        assertEquals(List.of("United States"), entry.nationalities());
    }

    @Test
    void testUnrecognisedLayoutFallsBackToRawText() {
        String text = "A stray paragraph that names no dates at all.";
        FortEntry entry = EntryAssembler.assemble(EntryFragment.unsegmented(text, null));
        assertFalse(entry.namePrimary().isEmpty());
        assertEquals(text, entry.entryRaw());
        assertEquals(text, entry.descriptionRaw());
        assertTrue(entry.periods().isEmpty());
        assertTrue(entry.altNames().isEmpty());
        assertEquals(FortTypeClassifier.DEFAULT_TYPE, entry.fortType());
    }

    @Test
    void testRawTextEntryForBlankText() {
        FortEntry entry = EntryAssembler.rawTextEntry(null, null);
        assertEquals(FieldSegmenter.UNNAMED, entry.namePrimary());
        assertEquals("", entry.entryRaw());
    }

    @Test
    void testSummarize() {
        assertEquals("Fort A (1812), Town - Desc.", EntryAssembler.summarize("Fort A", "1812", "Town", "Desc."));
        assertEquals("Fort A (1812) Desc.", EntryAssembler.summarize("Fort A", "1812", "", "Desc."));
        assertEquals("Fort A", EntryAssembler.summarize("Fort A", "", "", ""));
    }
}
