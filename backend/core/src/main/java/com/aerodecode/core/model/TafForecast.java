package com.aerodecode.core.model;

import java.util.List;

/**
 * A decoded TAF. When the header does not match, only {@code raw} and {@code error} are set.
 */
public record TafForecast(
        String raw,
        String error,
        String station,
        ReportTime issueTime,
        ValidityPeriod validity,
        boolean amendment,
        boolean correction,
        ForecastBody baseForecast,
        List<ChangeGroup> changeGroups,
        TemperatureExtremes temperatures
) {
    public TafForecast {
        changeGroups = changeGroups == null ? List.of() : List.copyOf(changeGroups);
    }

    public static TafForecast structuralError(String raw, String error) {
        return new TafForecast(raw, error, null, null, null, false, false, null, List.of(), null);
    }

    public boolean failed() {
        return error != null;
    }
}
