package com.aerodecode.core.model;

/**
 * Present or forecast weather. {@code descriptor} holds one or two two-letter codes,
 * {@code phenomena} one or more.
 */
public record WeatherPhenomenon(String intensity, String descriptor, String phenomena) {
    public String code() {
        return (intensity == null ? "" : intensity) + (descriptor == null ? "" : descriptor) + phenomena;
    }
}
