package com.aerodecode.decoder.print;

import com.aerodecode.core.model.CloudLayer;
import com.aerodecode.core.model.ForecastBody;
import com.aerodecode.core.model.Visibility;
import com.aerodecode.core.model.WeatherPhenomenon;
import com.aerodecode.core.model.Wind;
import com.aerodecode.decoder.phenomenon.WeatherPhenomenonTranslator;

import java.util.ArrayList;
import java.util.List;

/**
 * Line rendering for the fields both report types share.
 */
final class ForecastBodyFormatter {
    private ForecastBodyFormatter() {
    }

    static List<String> lines(ForecastBody body) {
        List<String> lines = new ArrayList<>();
        if (body.wind() != null) {
            lines.add(wind(body.wind()));
        }
        if (body.visibility() != null) {
            lines.add(visibility(body.visibility()));
        }
        lines.addAll(weather(body.weather()));
        lines.addAll(clouds(body.clouds()));
        return lines;
    }

    static String wind(Wind wind) {
        String unit = PrintVocabulary.WIND_UNIT.getOrDefault(wind.unit(), wind.unit());
        String direction = wind.variable() ? "переменный" : wind.direction() + "°";
        String gust = wind.gust() == null ? "" : ", порывы " + wind.gust();
        return "Ветер: " + direction + " " + wind.speed() + " " + unit + gust;
    }

    static String visibility(Visibility visibility) {
        if (visibility.cavok()) {
            return "CAVOK (погода хорошая)";
        }
        if (visibility.miles() != null) {
            return "Видимость: " + NumberText.format(visibility.miles()) + " миль (~" + visibility.meters() + " м)";
        }
        return "Видимость: " + visibility.meters() + " м";
    }

    static List<String> weather(List<WeatherPhenomenon> weather) {
        List<String> lines = new ArrayList<>();
        if (weather.isEmpty()) {
            return lines;
        }
        lines.add("Явления:");
        for (WeatherPhenomenon phenomenon : weather) {
            lines.add("  - " + WeatherPhenomenonTranslator.translate(phenomenon));
        }
        return lines;
    }

    static List<String> clouds(List<CloudLayer> clouds) {
        List<String> lines = new ArrayList<>();
        if (clouds.isEmpty()) {
            return lines;
        }
        lines.add("Облачность:");
        for (CloudLayer layer : clouds) {
            List<String> parts = new ArrayList<>();
            parts.add(PrintVocabulary.CLOUD_COVER.getOrDefault(layer.cover(), layer.cover()));
            if (layer.heightMeters() != null) {
                parts.add("на " + layer.heightMeters() + " метров");
            }
            if (layer.convective() != null) {
                parts.add(PrintVocabulary.CONVECTIVE_CLOUD.getOrDefault(layer.convective(), layer.convective()));
            }
            lines.add("  - " + String.join(" ", parts));
        }
        return lines;
    }

    static String indent(String line) {
        return "  " + line;
    }
}
