package com.aerodecode.decoder;

import com.aerodecode.core.model.MetarReport;
import com.aerodecode.core.model.ReportKind;
import com.aerodecode.core.model.TafForecast;

import java.util.Objects;

/**
 * One decoded report with its rendered text. Exactly one of {@code metar} and {@code taf} is set.
 */
public record DecodedReport(ReportKind kind, MetarReport metar, TafForecast taf, String text) {
    public DecodedReport {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(text, "text is required");
        if ((kind == ReportKind.METAR) != (metar != null) || (kind == ReportKind.TAF) != (taf != null)) {
            throw new IllegalArgumentException("Decoded record does not match kind " + kind);
        }
    }

    public static DecodedReport ofMetar(MetarReport metar, String text) {
        return new DecodedReport(ReportKind.METAR, metar, null, text);
    }

    public static DecodedReport ofTaf(TafForecast taf, String text) {
        return new DecodedReport(ReportKind.TAF, null, taf, text);
    }
}
