package com.aerodecode.core.model;

/**
 * Runway visual range as reported. Values keep their {@code P}/{@code M} prefixes.
 */
public record RunwayVisualRange(String runway, String value, String maxValue, String tendency) {
}
