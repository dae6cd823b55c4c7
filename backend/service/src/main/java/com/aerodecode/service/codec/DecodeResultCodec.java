package com.aerodecode.service.codec;

import com.aerodecode.core.model.ReportKind;
import com.aerodecode.core.util.JsonUtils;
import com.aerodecode.decoder.DecodedReport;

import java.time.LocalDateTime;

/**
 * JSON payload of one decoded report: kind, decoded record and its rendered text.
 */
public final class DecodeResultCodec {
    private DecodeResultCodec() {
    }

    public static String toJson(DecodedReport report) {
        return toJson(report, null);
    }

    public static String toJson(DecodedReport report, LocalDateTime archivedAt) {
        Object decoded = report.kind() == ReportKind.TAF ? report.taf() : report.metar();
        return JsonUtils.write(
                new Payload(report.kind(), archivedAt, decoded, report.text()),
                "decoded " + report.kind() + " report"
        );
    }

    private record Payload(ReportKind kind, LocalDateTime archivedAt, Object decoded, String pretty) {
    }
}
