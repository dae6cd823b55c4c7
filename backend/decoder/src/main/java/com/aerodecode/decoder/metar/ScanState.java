package com.aerodecode.decoder.metar;

/**
 * METAR scanner states. The only transitions are HEADER to MAIN_BODY or NIL, and MAIN_BODY to TREND.
 */
public enum ScanState {
    HEADER,
    MAIN_BODY,
    TREND,
    NIL;

    public ScanState afterHeader(boolean nilReport) {
        requireState(HEADER);
        return nilReport ? NIL : MAIN_BODY;
    }

    public ScanState afterTrendMarker() {
        if (this != MAIN_BODY && this != TREND) {
            throw new IllegalStateException("Trend marker is not valid in state " + this);
        }
        return TREND;
    }

    public boolean trendScoped() {
        return this == TREND;
    }

    private void requireState(ScanState expected) {
        if (this != expected) {
            throw new IllegalStateException("Expected state " + expected + " but was " + this);
        }
    }
}
