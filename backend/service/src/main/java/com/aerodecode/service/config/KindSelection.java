package com.aerodecode.service.config;

import com.aerodecode.core.model.ReportKind;

import java.util.Optional;

public enum KindSelection {
    AUTO,
    METAR,
    TAF;

    /**
     * The forced report kind, or empty when the kind is detected per report.
     */
    public Optional<ReportKind> forced() {
        if (this == AUTO) {
            return Optional.empty();
        }
        return Optional.of(ReportKind.valueOf(name()));
    }
}
