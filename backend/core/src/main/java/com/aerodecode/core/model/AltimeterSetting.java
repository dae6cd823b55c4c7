package com.aerodecode.core.model;

/**
 * Altimeter setting in both units. {@code reportedUnit} is {@code A} (inches of mercury) or {@code Q} (hectopascals).
 */
public record AltimeterSetting(char reportedUnit, double hectopascals, double inchesOfMercury) {
}
