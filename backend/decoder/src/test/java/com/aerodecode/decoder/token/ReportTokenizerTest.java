package com.aerodecode.decoder.token;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportTokenizerTest {
    @Test
    void wordsDropTrailingTerminatorAndExtraWhitespace() {
        assertEquals(
                List.of("METAR", "UUWW", "011200Z", "00000MPS", "CAVOK"),
                ReportTokenizer.words("  METAR UUWW\t011200Z   00000MPS CAVOK= ")
        );
        assertEquals(List.of("CAVOK"), ReportTokenizer.words("CAVOK ="));
        assertTrue(ReportTokenizer.words("   ").isEmpty());
        assertTrue(ReportTokenizer.words("=").isEmpty());
    }

    @Test
    void remarksStartAtFirstStandaloneMarker() {
        TokenizedReport report = ReportTokenizer.tokenize("METAR KJFK 211151Z 31008KT RMK AO2 SLP128=");

        assertEquals(List.of("METAR", "KJFK", "211151Z", "31008KT"), report.body());
        assertEquals(List.of("AO2", "SLP128"), report.remarkTokens());
        assertEquals("AO2 SLP128", report.remarks());
        assertTrue(report.hasRemarks());
    }

    @Test
    void embeddedMarkerDoesNotSplit() {
        TokenizedReport report = ReportTokenizer.tokenize("METAR KJFK RMKX 31008KT");

        assertEquals(4, report.body().size());
        assertFalse(report.hasRemarks());
        assertEquals("", report.remarks());
    }

    @Test
    void normalizeCollapsesLineBreaks() {
        assertEquals(
                "TAF UUWW 211100Z 2112/2212 CAVOK",
                ReportTokenizer.normalize("TAF  UUWW\n   211100Z 2112/2212\r\n CAVOK =")
        );
    }
}
