package com.aerodecode.core.model;

public enum ReportKind {
    METAR,
    TAF
}
