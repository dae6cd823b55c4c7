package com.aerodecode.service.runtime;

import com.aerodecode.core.util.JsonUtils;
import com.aerodecode.decoder.ReportDecoder;
import com.aerodecode.service.config.DecoderConfig;
import com.aerodecode.service.config.KindSelection;
import com.aerodecode.service.config.OutputFormat;
import com.aerodecode.service.support.FixtureUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecodeRunnerTest {
    private final ReportDecoder decoder = new ReportDecoder();
    private final String bulletin = FixtureUtils.readFixture("fixtures/uuww-bulletin.txt");

    @Test
    void decodesEveryEntryAsText() {
        List<String> outputs = new DecodeRunner(decoder, DecoderConfig.DEFAULTS).run(bulletin);

        assertEquals(3, outputs.size());
        assertTrue(outputs.get(0).startsWith("Исходный METAR: METAR UUWW 211100Z"));
        assertTrue(outputs.get(1).contains("  - слабый ливневый дождь"));
        assertTrue(outputs.get(2).startsWith("Исходный TAF: TAF UUWW 211100Z"));
    }

    @Test
    void latestOnlyKeepsNewestReport() {
        DecoderConfig config = new DecoderConfig(OutputFormat.TEXT, true, KindSelection.AUTO);

        List<String> outputs = new DecodeRunner(decoder, config).run(bulletin);

        assertEquals(1, outputs.size());
        assertTrue(outputs.get(0).contains("Время: 21 число, 12:30 UTC"));
    }

    @Test
    void jsonOutputKeepsArchiveTime() throws Exception {
        DecoderConfig config = DecoderConfig.DEFAULTS.withOutputFormat(OutputFormat.JSON);

        List<String> outputs = new DecodeRunner(decoder, config).run(bulletin);

        JsonNode first = JsonUtils.objectMapper().readTree(outputs.get(0));
        JsonNode last = JsonUtils.objectMapper().readTree(outputs.get(2));
        assertEquals("2024-03-21T11:00:00", first.get("archivedAt").asText());
        assertEquals("METAR", first.get("kind").asText());
        assertEquals("TAF", last.get("kind").asText());
        assertNull(last.get("archivedAt"));
    }

    @Test
    void forcedKindAppliesToEveryEntry() {
        DecoderConfig config = DecoderConfig.DEFAULTS.withKind(KindSelection.TAF);

        List<String> outputs = new DecodeRunner(decoder, config).run(bulletin);

        assertEquals("Ошибка: Неверный формат TAF", outputs.get(0));
        assertTrue(outputs.get(2).startsWith("Исходный TAF"));
    }

    @Test
    void emptyBulletinYieldsNothing() {
        assertTrue(new DecodeRunner(decoder, DecoderConfig.DEFAULTS).run("# no reports\n").isEmpty());
        assertThrows(NullPointerException.class, () -> new DecodeRunner(decoder, null));
    }
}
