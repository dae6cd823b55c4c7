package com.aerodecode.core.model;

public record CloudLayer(String cover, String heightCode, Integer heightMeters, String convective) {
}
