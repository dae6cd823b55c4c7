package com.aerodecode.core.model;

/**
 * Prevailing visibility. {@code meters} is always set; {@code miles} only for statute-mile reports.
 */
public record Visibility(int meters, Double miles, boolean cavok) {
    public static final int UNLIMITED_METERS = 10000;
    private static final int UNLIMITED_CODE = 9999;

    public static Visibility cavokVisibility() {
        return new Visibility(UNLIMITED_METERS, null, true);
    }

    public static Visibility ofMeters(int meters) {
        return new Visibility(meters == UNLIMITED_CODE ? UNLIMITED_METERS : meters, null, false);
    }

    public static Visibility ofMiles(double miles) {
        return new Visibility((int) Math.round(miles * 1609.344), miles, false);
    }
}
