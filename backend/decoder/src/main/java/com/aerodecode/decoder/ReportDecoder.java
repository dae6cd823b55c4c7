package com.aerodecode.decoder;

import com.aerodecode.core.model.MetarReport;
import com.aerodecode.core.model.ReportKind;
import com.aerodecode.core.model.TafForecast;
import com.aerodecode.decoder.api.ReportPrinter;
import com.aerodecode.decoder.api.ReportScanner;
import com.aerodecode.decoder.metar.MetarScanner;
import com.aerodecode.decoder.print.MetarPrinter;
import com.aerodecode.decoder.print.TafPrinter;
import com.aerodecode.decoder.taf.TafScanner;
import com.aerodecode.decoder.token.ReportTokenizer;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Entry point of the engine: picks the pipeline for a raw report and renders the result.
 * Holds no per-call state, so one instance can serve concurrent callers.
 */
public class ReportDecoder {
    private static final Pattern VALIDITY_WINDOW = Pattern.compile("^\\d{4}/\\d{4}$");
    private static final int HEADER_LOOKAHEAD = 5;

    private final ReportScanner<MetarReport> metarScanner;
    private final ReportScanner<TafForecast> tafScanner;
    private final ReportPrinter<MetarReport> metarPrinter;
    private final ReportPrinter<TafForecast> tafPrinter;

    public ReportDecoder() {
        this(new MetarScanner(), new TafScanner(), new MetarPrinter(), new TafPrinter());
    }

    public ReportDecoder(
            ReportScanner<MetarReport> metarScanner,
            ReportScanner<TafForecast> tafScanner,
            ReportPrinter<MetarReport> metarPrinter,
            ReportPrinter<TafForecast> tafPrinter
    ) {
        this.metarScanner = Objects.requireNonNull(metarScanner, "metarScanner is required");
        this.tafScanner = Objects.requireNonNull(tafScanner, "tafScanner is required");
        this.metarPrinter = Objects.requireNonNull(metarPrinter, "metarPrinter is required");
        this.tafPrinter = Objects.requireNonNull(tafPrinter, "tafPrinter is required");
    }

    /**
     * TAF when the report opens with {@code TAF} or carries a {@code DDHH/DDHH} validity window
     * among its first header groups; METAR otherwise.
     */
    public static ReportKind detectKind(String raw) {
        List<String> words = ReportTokenizer.words(Objects.requireNonNull(raw, "raw report is required"));
        if (!words.isEmpty() && "TAF".equals(words.get(0))) {
            return ReportKind.TAF;
        }
        for (String word : words.subList(0, Math.min(HEADER_LOOKAHEAD, words.size()))) {
            if (VALIDITY_WINDOW.matcher(word).matches()) {
                return ReportKind.TAF;
            }
        }
        return ReportKind.METAR;
    }

    public DecodedReport decode(String raw) {
        return decode(raw, detectKind(raw));
    }

    public DecodedReport decode(String raw, ReportKind kind) {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == ReportKind.TAF) {
            TafForecast forecast = decodeTaf(raw);
            return DecodedReport.ofTaf(forecast, tafPrinter.print(forecast));
        }
        MetarReport report = decodeMetar(raw);
        return DecodedReport.ofMetar(report, metarPrinter.print(report));
    }

    public MetarReport decodeMetar(String raw) {
        return metarScanner.scan(Objects.requireNonNull(raw, "raw report is required"));
    }

    public TafForecast decodeTaf(String raw) {
        return tafScanner.scan(Objects.requireNonNull(raw, "raw report is required"));
    }
}
