package com.aerodecode.decoder.print;

import com.aerodecode.core.model.ChangeGroup;
import com.aerodecode.core.model.DayHour;
import com.aerodecode.core.model.ForecastBody;
import com.aerodecode.core.model.ReportTime;
import com.aerodecode.core.model.TafForecast;
import com.aerodecode.core.model.TemperatureExtremes;
import com.aerodecode.core.model.ValidityPeriod;
import com.aerodecode.decoder.api.ReportPrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class TafPrinter implements ReportPrinter<TafForecast> {
    @Override
    public String print(TafForecast forecast) {
        if (forecast.failed()) {
            return "Ошибка: " + forecast.error();
        }
        List<String> lines = new ArrayList<>();
        lines.add("Исходный TAF: " + forecast.raw());
        lines.add("");
        lines.add("Станция: " + forecast.station());
        lines.add("Время выпуска: " + MetarPrinter.time(forecast.issueTime()));
        lines.add("Период действия: " + period(forecast.validity()));
        if (forecast.amendment()) {
            lines.add("Исправленный прогноз (AMD)");
        }
        if (forecast.correction()) {
            lines.add("Корректировка (COR)");
        }

        lines.add("");
        lines.add("=== БАЗОВЫЙ ПРОГНОЗ ===");
        lines.addAll(body(forecast.baseForecast()));

        TemperatureExtremes temperatures = forecast.temperatures();
        if (temperatures != null) {
            lines.add("");
            lines.add("Максимальная температура: " + temperatures.max() + "°C в " + dayHour(temperatures.maxAt()));
            lines.add("Минимальная температура: " + temperatures.min() + "°C в " + dayHour(temperatures.minAt()));
        }

        if (!forecast.changeGroups().isEmpty()) {
            lines.add("");
            lines.add("=== ИЗМЕНЕНИЯ ===");
            for (ChangeGroup group : forecast.changeGroups()) {
                lines.add("");
                lines.add(PrintVocabulary.CHANGE_GROUP_TITLE.get(group.type()) + ":");
                if (group.from() != null) {
                    lines.add(ForecastBodyFormatter.indent("С " + fromTime(group.from())));
                } else if (group.period() != null) {
                    lines.add(ForecastBodyFormatter.indent("Период: " + period(group.period())));
                }
                for (String line : body(group.forecast())) {
                    lines.add(ForecastBodyFormatter.indent(line));
                }
            }
        }
        return String.join("\n", lines);
    }

    private static List<String> body(ForecastBody body) {
        List<String> lines = ForecastBodyFormatter.lines(body);
        if (lines.isEmpty()) {
            lines.add("(нет изменений)");
        }
        if (!body.unparsed().isEmpty()) {
            lines.add("Нераспознанные группы: " + String.join(" ", body.unparsed()));
        }
        return lines;
    }

    private static String period(ValidityPeriod period) {
        return "с " + dayHour(period.from()) + " до " + dayHour(period.to());
    }

    private static String dayHour(DayHour dayHour) {
        return String.format(Locale.ROOT, "%02d %02d:00 UTC", dayHour.day(), dayHour.hour());
    }

    private static String fromTime(ReportTime time) {
        return String.format(Locale.ROOT, "%02d %02d:%02d UTC", time.day(), time.hour(), time.minute());
    }
}
