package com.aerodecode.core.model;

/**
 * A {@code DDHH} group. Hour 24 is kept as a literal end-of-day value.
 */
public record DayHour(int day, int hour) {
    public static DayHour parse(String ddhh) {
        return new DayHour(Integer.parseInt(ddhh.substring(0, 2)), Integer.parseInt(ddhh.substring(2, 4)));
    }
}
