package com.aerodecode.core.model;

import java.util.List;

public record ForecastBody(
        Wind wind,
        Visibility visibility,
        List<WeatherPhenomenon> weather,
        List<CloudLayer> clouds,
        List<String> unparsed
) {
    public static final ForecastBody EMPTY = new ForecastBody(null, null, List.of(), List.of(), List.of());

    public ForecastBody {
        weather = weather == null ? List.of() : List.copyOf(weather);
        clouds = clouds == null ? List.of() : List.copyOf(clouds);
        unparsed = unparsed == null ? List.of() : List.copyOf(unparsed);
    }

    public boolean hasContent() {
        return wind != null || visibility != null || !weather.isEmpty() || !clouds.isEmpty();
    }
}
