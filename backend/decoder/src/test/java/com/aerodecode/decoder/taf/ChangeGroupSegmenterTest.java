package com.aerodecode.decoder.taf;

import com.aerodecode.core.model.ChangeGroupType;
import com.aerodecode.core.model.DayHour;
import com.aerodecode.core.model.ReportTime;
import com.aerodecode.core.model.ValidityPeriod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeGroupSegmenterTest {
    @Test
    void splitsBaseAndGroupsInOrder() {
        ChangeGroupSegmenter.Segments segments = ChangeGroupSegmenter.segment(List.of(
                "20013KT", "9999", "TEMPO", "2112/2120", "-RA", "FM211800", "VRB02KT", "BECMG", "BKN010"));

        assertEquals(List.of("20013KT", "9999"), segments.base());
        assertEquals(3, segments.groups().size());

        ChangeGroupSegmenter.Segment tempo = segments.groups().get(0);
        assertEquals(ChangeGroupType.TEMPO, tempo.type());
        assertEquals(new ValidityPeriod(new DayHour(21, 12), new DayHour(21, 20)), tempo.period());
        assertEquals(List.of("-RA"), tempo.tokens());

        ChangeGroupSegmenter.Segment from = segments.groups().get(1);
        assertEquals(ChangeGroupType.FM, from.type());
        assertEquals(new ReportTime(21, 18, 0), from.from());
        assertNull(from.period());
        assertEquals(List.of("VRB02KT"), from.tokens());

        ChangeGroupSegmenter.Segment becoming = segments.groups().get(2);
        assertNull(becoming.period());
        assertEquals(List.of("BKN010"), becoming.tokens());
    }

    @Test
    void probabilityMergesWithImmediateTempo() {
        ChangeGroupSegmenter.Segments segments = ChangeGroupSegmenter.segment(List.of(
                "CAVOK", "PROB40", "TEMPO", "2114/2118", "TSRA", "PROB30", "2203/2206", "BR"));

        assertEquals(ChangeGroupType.PROB40_TEMPO, segments.groups().get(0).type());
        assertEquals(List.of("TSRA"), segments.groups().get(0).tokens());
        assertEquals(ChangeGroupType.PROB30, segments.groups().get(1).type());
        assertEquals(new DayHour(22, 3), segments.groups().get(1).period().from());
    }

    @Test
    void periodOnlyCountsRightAfterMarker() {
        ChangeGroupSegmenter.Segments segments = ChangeGroupSegmenter.segment(List.of("BECMG", "27008KT", "2120/2122"));

        assertNull(segments.groups().get(0).period());
        assertEquals(List.of("27008KT", "2120/2122"), segments.groups().get(0).tokens());
    }

    @Test
    void markerShapes() {
        assertTrue(ChangeGroupSegmenter.isMarker("FM211800"));
        assertFalse(ChangeGroupSegmenter.isMarker("FM1800"));
        assertFalse(ChangeGroupSegmenter.isMarker("PROB50"));
        assertTrue(ChangeGroupSegmenter.period("2224/2306").isPresent());
        assertTrue(ChangeGroupSegmenter.period("222/2306").isEmpty());
    }
}
