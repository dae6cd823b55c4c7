package com.aerodecode.core.model;

public record TemperatureDewpoint(int temperature, int dewpoint, Double relativeHumidity) {
}
