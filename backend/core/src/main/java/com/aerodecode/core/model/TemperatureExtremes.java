package com.aerodecode.core.model;

public record TemperatureExtremes(int max, DayHour maxAt, int min, DayHour minAt) {
}
