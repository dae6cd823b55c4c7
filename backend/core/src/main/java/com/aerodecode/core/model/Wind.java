package com.aerodecode.core.model;

/**
 * Surface wind. {@code direction} is either three digits of degrees or {@link #VARIABLE}.
 */
public record Wind(String direction, int speed, Integer gust, String unit) {
    public static final String VARIABLE = "VRB";
    public static final String DEFAULT_UNIT = "KT";

    public Wind {
        if (unit == null || unit.isEmpty()) {
            unit = DEFAULT_UNIT;
        }
    }

    public boolean variable() {
        return VARIABLE.equals(direction);
    }
}
