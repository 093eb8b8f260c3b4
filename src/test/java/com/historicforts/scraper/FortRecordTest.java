package com.historicforts.scraper;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FortRecordTest {

    @Test
    void testToMapHasExactColumns() {
        FortRecord record = Fixtures.record("Fort Hill", "(1775, 1812 - 1815)", "ct");
        Map<String, Object> map = record.toMap();
        assertEquals(FortRecord.COLUMNS, new ArrayList<>(map.keySet()));
        assertEquals("CT", map.get("state_territory"));
        assertEquals("Connecticut", map.get("state_full_name"));
        assertEquals("United States", map.get("nationality"));
        assertNull(map.get("alt_names"));
        assertEquals(1775, map.get("earliest_year"));
        assertEquals(1815, map.get("latest_year"));
    }

    @Test
    void testListsJoinedAndEmptyTextNulled() {
        FortEntry entry = new FortEntry("Fort Hill", "", "", "", "Fort Hill", List.of("Fort A", "Fort B"),
            List.of("France", "Spain"), List.of(), null, null, null);
        Map<String, Object> map = new FortRecord(entry, Fixtures.CT_SOURCE).toMap();
        assertEquals("Fort A|Fort B", map.get("alt_names"));
        assertEquals("France|Spain", map.get("nationality"));
        assertNull(map.get("location_text"));
        assertNull(map.get("dates_raw"));
        assertNull(map.get("description_raw"));
        assertEquals("fort", map.get("fort_type"));
    }

    @Test
    void testPeriodMapsInOrder() {
        List<Map<String, Object>> periods = Fixtures.record("Fort Hill", "(1775, 1812 - 1815)", "ct").periodMaps();
        assertEquals(2, periods.size());
        assertEquals(List.of("start_year", "end_year", "period_notes", "period_order"), new ArrayList<>(periods.get(0).keySet()));
        assertEquals(0, periods.get(0).get("period_order"));
        assertEquals(1815, periods.get(1).get("end_year"));
    }

    @Test
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new FortRecord(null, Fixtures.CT_SOURCE));
        assertThrows(IllegalArgumentException.class, () -> new FortEntry(" ", null, null, null, null,
            null, null, null, null, null, null));
    }
}
