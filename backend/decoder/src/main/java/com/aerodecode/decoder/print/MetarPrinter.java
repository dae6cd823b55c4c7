package com.aerodecode.decoder.print;

import com.aerodecode.core.model.AltimeterSetting;
import com.aerodecode.core.model.MetarReport;
import com.aerodecode.core.model.ReportTime;
import com.aerodecode.core.model.RunwayCondition;
import com.aerodecode.core.model.RunwayVisualRange;
import com.aerodecode.core.model.TemperatureDewpoint;
import com.aerodecode.core.model.TrendGroup;
import com.aerodecode.core.model.Visibility;
import com.aerodecode.decoder.api.ReportPrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed-order text rendering of a {@link MetarReport}. Prints only what the record holds.
 */
public class MetarPrinter implements ReportPrinter<MetarReport> {
    private static final String NOT_REPORTED = "//";

    @Override
    public String print(MetarReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("Исходный METAR: " + report.raw());
        if (report.reportType() != null) {
            lines.add("Тип отчёта: " + report.reportType());
        }
        if (report.station() != null) {
            lines.add("Станция: " + report.station());
        }
        if (report.time() != null) {
            lines.add("Время: " + time(report.time()));
        }
        if (report.nil()) {
            lines.add("Отчёт NIL (данные отсутствуют)");
            return String.join("\n", lines);
        }
        if (report.automated()) {
            lines.add("Автоматическое наблюдение");
        }
        if (report.wind() != null) {
            lines.add(ForecastBodyFormatter.wind(report.wind()));
        }
        if (report.windVariability() != null) {
            lines.add("Ветер переменный " + report.windVariability().from() + "°-" + report.windVariability().to() + "°");
        }
        if (report.visibility() != null) {
            lines.add(ForecastBodyFormatter.visibility(report.visibility()));
        }
        for (RunwayVisualRange range : report.runwayVisualRanges()) {
            lines.add(runwayVisualRange(range));
        }
        for (RunwayCondition condition : report.runwayConditions()) {
            lines.add(runwayCondition(condition));
        }
        lines.addAll(ForecastBodyFormatter.weather(report.weather()));
        lines.addAll(ForecastBodyFormatter.clouds(report.clouds()));
        if (report.temperature() != null) {
            lines.addAll(temperature(report.temperature()));
        }
        if (report.altimeter() != null) {
            lines.add(altimeter(report.altimeter()));
        }
        for (TrendGroup trend : report.trends()) {
            lines.add(trend(trend));
        }
        for (Visibility visibility : report.trendVisibilities()) {
            lines.add(ForecastBodyFormatter.visibility(visibility));
        }
        lines.addAll(ForecastBodyFormatter.weather(report.trendWeather()));
        lines.addAll(ForecastBodyFormatter.clouds(report.trendClouds()));
        if (!report.remarks().isEmpty()) {
            lines.add("Замечания: " + report.remarks());
            for (Map.Entry<String, Object> detail : report.remarkDetails().describe().entrySet()) {
                lines.add("  - " + detail.getKey() + ": " + NumberText.format(detail.getValue()));
            }
        }
        if (!report.unparsed().isEmpty()) {
            lines.add("Нераспознанные группы: " + String.join(" ", report.unparsed()));
        }
        return String.join("\n", lines);
    }

    static String time(ReportTime time) {
        return String.format(Locale.ROOT, "%02d число, %02d:%02d UTC", time.day(), time.hour(), time.minute());
    }

    /**
     * Slash-separated and long all-digit values are shown as reported; the others with P/M as &gt;/&lt;.
     */
    static String runwayVisualRange(RunwayVisualRange range) {
        String value = range.value();
        String prefix = "Дальность видимости на ВПП " + range.runway() + ": ";
        StringBuilder line = new StringBuilder(prefix);
        if (value.contains(NOT_REPORTED)) {
            String[] parts = value.split(NOT_REPORTED, 2);
            line.append(parts[0]).append(" м (данные: ").append(parts[1]).append(")");
        } else if (value.length() > 4 && value.chars().allMatch(Character::isDigit)) {
            line.append(value).append(" м");
        } else {
            line.append(comparative(value)).append(" м");
        }
        if (range.maxValue() != null) {
            line.append(" до ").append(comparative(range.maxValue())).append(" м");
        }
        if (range.tendency() != null) {
            line.append(" (")
                    .append(PrintVocabulary.RVR_TENDENCY.getOrDefault(range.tendency(), range.tendency()))
                    .append(")");
        }
        return line.toString();
    }

    static String runwayCondition(RunwayCondition condition) {
        StringBuilder line = new StringBuilder("Состояние ВПП ").append(condition.runway()).append(": ")
                .append(PrintVocabulary.RUNWAY_CONTAMINATION.getOrDefault(condition.contamination(), condition.contamination()));
        line.append(", покрытие ")
                .append(PrintVocabulary.RUNWAY_EXTENT.getOrDefault(condition.extent(), condition.extent()));
        String depth = condition.depth();
        if (!"00".equals(depth) && !NOT_REPORTED.equals(depth)) {
            line.append(", глубина ").append(depth).append(" мм");
        }
        String friction = condition.friction();
        if (!NOT_REPORTED.equals(friction)) {
            line.append(", коэффициент сцепления 0.").append(friction);
            if (Integer.parseInt(friction) >= 95) {
                line.append("+");
            }
        }
        return line.toString();
    }

    private static List<String> temperature(TemperatureDewpoint temperature) {
        List<String> lines = new ArrayList<>();
        lines.add("Температура: " + temperature.temperature() + "°C");
        lines.add("Точка росы: " + temperature.dewpoint() + "°C");
        if (temperature.relativeHumidity() != null) {
            lines.add("Относительная влажность: " + NumberText.format(temperature.relativeHumidity()) + "%");
        }
        return lines;
    }

    private static String altimeter(AltimeterSetting altimeter) {
        return "Давление: " + NumberText.format(altimeter.hectopascals()) + " гПа ("
                + NumberText.format(altimeter.inchesOfMercury()) + " дюйм рт. ст.)";
    }

    private static String trend(TrendGroup trend) {
        String marker = trend.marker();
        String known = PrintVocabulary.TREND_MARKER.get(marker);
        if (known != null) {
            return known;
        }
        String prefix = PrintVocabulary.TREND_TIME_PREFIX.get(marker.substring(0, 2));
        if (prefix != null) {
            return prefix + " " + marker.substring(2) + " UTC";
        }
        return marker;
    }

    private static String comparative(String value) {
        return value.replace("P", ">").replace("M", "<");
    }
}
