package com.aerodecode.service.config;

public record DecoderConfig(OutputFormat outputFormat, boolean latestOnly, KindSelection kind) {
    public static final DecoderConfig DEFAULTS = new DecoderConfig(OutputFormat.TEXT, false, KindSelection.AUTO);

    public DecoderConfig {
        outputFormat = outputFormat == null ? OutputFormat.TEXT : outputFormat;
        kind = kind == null ? KindSelection.AUTO : kind;
    }

    public DecoderConfig withOutputFormat(OutputFormat outputFormat) {
        return new DecoderConfig(outputFormat, latestOnly, kind);
    }

    public DecoderConfig withKind(KindSelection kind) {
        return new DecoderConfig(outputFormat, latestOnly, kind);
    }
}
