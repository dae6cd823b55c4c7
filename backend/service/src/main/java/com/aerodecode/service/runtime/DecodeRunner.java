package com.aerodecode.service.runtime;

import com.aerodecode.decoder.DecodedReport;
import com.aerodecode.decoder.ReportDecoder;
import com.aerodecode.service.bulletin.BulletinEntry;
import com.aerodecode.service.bulletin.BulletinReader;
import com.aerodecode.service.bulletin.LatestReportSelector;
import com.aerodecode.service.codec.DecodeResultCodec;
import com.aerodecode.service.config.DecoderConfig;
import com.aerodecode.service.config.OutputFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Decodes every report of a bulletin, or only the latest one, and renders each in the configured format.
 */
public class DecodeRunner {
    private static final Logger LOGGER = Logger.getLogger(DecodeRunner.class.getName());

    private final ReportDecoder decoder;
    private final DecoderConfig config;

    public DecodeRunner(ReportDecoder decoder, DecoderConfig config) {
        this.decoder = Objects.requireNonNull(decoder, "decoder is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public List<String> run(String bulletin) {
        List<BulletinEntry> entries = BulletinReader.read(bulletin);
        if (config.latestOnly()) {
            entries = LatestReportSelector.latest(entries).map(List::of).orElse(List.of());
        }
        if (entries.isEmpty()) {
            LOGGER.warning("No reports found in input");
        }

        List<String> outputs = new ArrayList<>();
        for (BulletinEntry entry : entries) {
            DecodedReport decoded = config.kind().forced()
                    .map(kind -> decoder.decode(entry.report(), kind))
                    .orElseGet(() -> decoder.decode(entry.report()));
            outputs.add(config.outputFormat() == OutputFormat.JSON
                    ? DecodeResultCodec.toJson(decoded, entry.archivedAt())
                    : decoded.text());
        }
        return outputs;
    }
}
