package com.aerodecode.core.model;

import java.util.Objects;

/**
 * One conditional forecast amendment. {@code period} is set for BECMG, TEMPO and PROB groups
 * that carry an explicit {@code DDHH/DDHH} window; {@code from} only for FM groups.
 */
public record ChangeGroup(ChangeGroupType type, ValidityPeriod period, ReportTime from, ForecastBody forecast) {
    public ChangeGroup {
        Objects.requireNonNull(type, "type is required");
        forecast = forecast == null ? ForecastBody.EMPTY : forecast;
    }
}
