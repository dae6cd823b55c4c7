package com.aerodecode.decoder.print;

import com.aerodecode.core.model.ReportTime;
import com.aerodecode.core.model.RunwayCondition;
import com.aerodecode.core.model.RunwayVisualRange;
import com.aerodecode.decoder.metar.MetarScanner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetarPrinterTest {
    private final MetarScanner scanner = new MetarScanner();
    private final MetarPrinter printer = new MetarPrinter();

    @Test
    void printsObservationInFixedOrder() {
        String raw = "METAR UUWW 211130Z 18005MPS 150V210 9999 -SHRA BKN020CB 15/10 Q1013 NOSIG";
        List<String> lines = lines(raw);

        assertEquals(List.of(
                "Исходный METAR: " + raw,
                "Тип отчёта: METAR",
                "Станция: UUWW",
                "Время: 21 число, 11:30 UTC",
                "Ветер: 180° 5 м/с",
                "Ветер переменный 150°-210°",
                "Видимость: 10000 м",
                "Явления:",
                "  - слабый ливневый дождь",
                "Облачность:",
                "  - разорванные облака (6-9 баллов) на 600 метров кучево-дождевые",
                "Температура: 15°C",
                "Точка росы: 10°C"
        ), lines.subList(0, 13));
        assertTrue(lines.get(13).startsWith("Относительная влажность: "));
        assertEquals("Давление: 1013 гПа (759.75 дюйм рт. ст.)", lines.get(14));
        assertEquals("Прогноз без изменений", lines.get(15));
        assertEquals(16, lines.size());
    }

    @Test
    void nilReportPrintsHeaderOnly() {
        List<String> lines = lines("METAR UUEE 211200Z NIL");

        assertEquals("Отчёт NIL (данные отсутствуют)", lines.get(lines.size() - 1));
        assertEquals(5, lines.size());
    }

    @Test
    void printsMilesRemarksAndLeftovers() {
        List<String> lines = lines(
                "METAR KJFK 211151Z 31008KT 1 1/2SM BR WS OVC005 M01/M02 A2992 RMK AO2 SLP128 T10111022");

        assertTrue(lines.contains("Видимость: 1.5 миль (~2414 м)"));
        assertTrue(lines.contains("  - дымка"));
        assertTrue(lines.contains("  - сплошная облачность (10 баллов) на 150 метров"));
        assertTrue(lines.contains("Давление: 1013.2 гПа (29.92 дюйм рт. ст.)"));
        assertTrue(lines.contains("Замечания: AO2 SLP128 T10111022"));
        assertTrue(lines.contains("  - тип станции: AO2"));
        assertTrue(lines.contains("  - давление на уровне моря (гПа): 1012.8"));
        assertTrue(lines.contains("  - дополнительные температуры: -1.1, -2.2"));
        assertEquals("Нераспознанные группы: WS", lines.get(lines.size() - 1));
    }

    @Test
    void printsTrendMarkersWithTimes() {
        List<String> lines = lines("METAR UUWW 211200Z VRB02KT CAVOK 10/05 Q1010 TEMPO FM1230 TL1330 AT1300 2000 +SN");

        assertTrue(lines.contains("Ветер: переменный 2 узлы"));
        assertTrue(lines.contains("CAVOK (погода хорошая)"));
        assertTrue(lines.contains("Временные изменения"));
        assertTrue(lines.contains("с 1230 UTC"));
        assertTrue(lines.contains("до 1330 UTC"));
        assertTrue(lines.contains("в 1300 UTC"));
        assertTrue(lines.contains("Видимость: 2000 м"));
        assertTrue(lines.contains("  - сильный снег"));
        assertFalse(lines.stream().anyMatch(line -> line.startsWith("Нераспознанные")));
    }

    @Test
    void runwayVisualRangeForms() {
        assertEquals("Дальность видимости на ВПП 24: 1200 м (без изменений)",
                MetarPrinter.runwayVisualRange(new RunwayVisualRange("24", "1200", null, "N")));
        assertEquals("Дальность видимости на ВПП 06: <0050 м до >1500 м (увеличивается)",
                MetarPrinter.runwayVisualRange(new RunwayVisualRange("06", "M0050", "P1500", "U")));
        assertEquals("Дальность видимости на ВПП 24: 12 м (данные: 60)",
                MetarPrinter.runwayVisualRange(new RunwayVisualRange("24", "12//60", null, null)));
        assertEquals("Дальность видимости на ВПП 33L: 12000 м",
                MetarPrinter.runwayVisualRange(new RunwayVisualRange("33L", "12000", null, null)));
    }

    @Test
    void runwayConditionSuppressesUnreportedParts() {
        assertEquals("Состояние ВПП 25: влажная, покрытие 11-25%, коэффициент сцепления 0.60",
                MetarPrinter.runwayCondition(new RunwayCondition("25", "1", "2", "//", "60")));
        assertEquals("Состояние ВПП 88: сухой снег, покрытие 51-100%, глубина 05 мм, коэффициент сцепления 0.95+",
                MetarPrinter.runwayCondition(new RunwayCondition("88", "4", "9", "05", "95")));
        assertEquals("Состояние ВПП 24: тип не определён, покрытие не сообщается",
                MetarPrinter.runwayCondition(new RunwayCondition("24", "/", "NR", "00", "//")));
    }

    @Test
    void timeIsZeroPadded() {
        assertEquals("01 число, 05:00 UTC", MetarPrinter.time(new ReportTime(1, 5, 0)));
    }

    private List<String> lines(String raw) {
        return List.of(printer.print(scanner.scan(raw)).split("\n"));
    }
}
