package com.aerodecode.service.bulletin;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LatestReportSelectorTest {
    @Test
    void picksGreatestDayAndHour() {
        BulletinEntry early = new BulletinEntry(null, "METAR UUWW 302300Z CAVOK");
        BulletinEntry late = new BulletinEntry(null, "METAR UUWW 310030Z CAVOK");
        BulletinEntry undated = new BulletinEntry(null, "METAR UUWW CAVOK");

        assertEquals(late, LatestReportSelector.latest(List.of(undated, early, late)).orElseThrow());
    }

    @Test
    void tiesKeepFirstAndMinutesAreIgnored() {
        BulletinEntry first = new BulletinEntry(null, "METAR UUWW 211100Z CAVOK");
        BulletinEntry second = new BulletinEntry(null, "METAR UUWW 211130Z CAVOK");

        assertEquals(first, LatestReportSelector.latest(List.of(first, second)).orElseThrow());
        assertEquals(2111, LatestReportSelector.rank(second.report()));
    }

    @Test
    void undatedOnlyAndEmptyInput() {
        BulletinEntry undated = new BulletinEntry(null, "METAR UUWW CAVOK");

        assertEquals(-1, LatestReportSelector.rank(undated.report()));
        assertEquals(undated, LatestReportSelector.latest(List.of(undated)).orElseThrow());
        assertTrue(LatestReportSelector.latest(List.of()).isEmpty());
    }
}
