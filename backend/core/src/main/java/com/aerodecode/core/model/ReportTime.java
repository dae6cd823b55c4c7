package com.aerodecode.core.model;

/**
 * A {@code DDHHMM} group. Values are taken verbatim from the report and are not range checked.
 */
public record ReportTime(int day, int hour, int minute) {
    public static ReportTime parse(String ddhhmm) {
        return new ReportTime(
                Integer.parseInt(ddhhmm.substring(0, 2)),
                Integer.parseInt(ddhhmm.substring(2, 4)),
                Integer.parseInt(ddhhmm.substring(4, 6))
        );
    }
}
