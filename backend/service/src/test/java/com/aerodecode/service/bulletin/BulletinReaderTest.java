package com.aerodecode.service.bulletin;

import com.aerodecode.service.support.FixtureUtils;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulletinReaderTest {
    @Test
    void readsArchiveLinesContinuationsAndPlainReports() {
        List<BulletinEntry> entries = BulletinReader.read(FixtureUtils.readFixture("fixtures/uuww-bulletin.txt"));

        assertEquals(3, entries.size());
        assertEquals(LocalDateTime.of(2024, 3, 21, 11, 0), entries.get(0).archivedAt());
        assertEquals("METAR UUWW 211100Z 18005MPS 9999 BKN020 10/05 Q1013 NOSIG", entries.get(0).report());
        assertEquals(
                "METAR UUWW 211230Z 18006MPS 9999 -SHRA BKN020CB 11/05 Q1012 NOSIG",
                entries.get(1).report()
        );
        assertNull(entries.get(2).archivedAt());
        assertEquals(
                "TAF UUWW 211100Z 2112/2212 18005MPS 9999 SCT030 TEMPO 2114/2118 -TSRA BKN015CB",
                entries.get(2).report()
        );
    }

    @Test
    void invalidArchiveTimeKeepsReport() {
        List<BulletinEntry> entries = BulletinReader.read("202413991100 METAR UUWW 211100Z CAVOK=");

        assertEquals(1, entries.size());
        assertNull(entries.get(0).archivedAt());
        assertEquals("METAR UUWW 211100Z CAVOK", entries.get(0).report());
    }

    @Test
    void blankInputHasNoEntries() {
        assertTrue(BulletinReader.read("").isEmpty());
        assertTrue(BulletinReader.read("\n  \n# nothing here\n").isEmpty());
    }
}
