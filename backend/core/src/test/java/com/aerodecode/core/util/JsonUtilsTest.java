package com.aerodecode.core.util;

import com.aerodecode.core.model.ChangeGroup;
import com.aerodecode.core.model.ChangeGroupType;
import com.aerodecode.core.model.DayHour;
import com.aerodecode.core.model.ForecastBody;
import com.aerodecode.core.model.ValidityPeriod;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        JsonNode tree = first.readTree(first.writeValueAsString(
                new Archived("METAR UUWW 011200Z", null, LocalDateTime.of(2024, 3, 1, 12, 0))));
        assertEquals("2024-03-01T12:00:00", tree.get("archivedAt").asText());
        assertFalse(tree.has("note"));
    }

    @Test
    void changeGroupTypeSerializesAsItsLabel() throws Exception {
        ChangeGroup group = new ChangeGroup(
                ChangeGroupType.PROB40_TEMPO,
                new ValidityPeriod(new DayHour(21, 14), new DayHour(21, 18)),
                null,
                ForecastBody.EMPTY
        );

        JsonNode tree = JsonUtils.objectMapper().readTree(JsonUtils.objectMapper().writeValueAsString(group));
        assertEquals("PROB40 TEMPO", tree.get("type").asText());
        assertEquals(21, tree.get("period").get("from").get("day").asInt());
        assertFalse(tree.has("from"));
        assertTrue(tree.get("forecast").get("weather").isArray());
    }

    @Test
    void readAndWriteWrapFailures() throws Exception {
        Path dir = Files.createTempDirectory("json-utils-");
        Path good = Files.writeString(dir.resolve("good.json"), "{\"report\":\"METAR UUWW\",\"extra\":1}");
        Path bad = Files.writeString(dir.resolve("bad.json"), "{\"report\":");

        Archived parsed = JsonUtils.read(good, new TypeReference<>() {
        });
        assertEquals("METAR UUWW", parsed.report());

        IllegalStateException readError = assertThrows(IllegalStateException.class,
                () -> JsonUtils.read(bad, new TypeReference<Archived>() {
                }));
        assertTrue(readError.getMessage().endsWith("bad.json"));

        IllegalStateException writeError = assertThrows(IllegalStateException.class,
                () -> JsonUtils.write(new Object(), "empty bean"));
        assertEquals("Unable to serialize empty bean", writeError.getMessage());
    }

    private record Archived(String report, String note, LocalDateTime archivedAt) {
    }
}
