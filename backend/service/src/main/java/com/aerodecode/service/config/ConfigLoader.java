package com.aerodecode.service.config;

import com.aerodecode.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

public final class ConfigLoader {
    public static final String CONFIG_FILE = "decoder.json";

    private ConfigLoader() {
    }

    /**
     * Reads {@code decoder.json} from the directory; a missing file means defaults.
     */
    public static DecoderConfig loadDecoder(Path configDir) {
        Path path = configDir.resolve(CONFIG_FILE);
        if (!Files.exists(path)) {
            return DecoderConfig.DEFAULTS;
        }
        return JsonUtils.read(path, new TypeReference<>() {
        });
    }

    /**
     * Applies {@code DECODER_OUTPUT} and {@code DECODER_KIND} on top of the file configuration.
     */
    public static DecoderConfig applyEnvironment(DecoderConfig config, Map<String, String> env, Consumer<String> warn) {
        DecoderConfig resolved = config;
        String outputRaw = env.get("DECODER_OUTPUT");
        if (outputRaw != null) {
            try {
                resolved = resolved.withOutputFormat(OutputFormat.valueOf(outputRaw.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                warn.accept("Unknown DECODER_OUTPUT=" + outputRaw + ", keeping " + resolved.outputFormat());
            }
        }
        String kindRaw = env.get("DECODER_KIND");
        if (kindRaw != null) {
            try {
                resolved = resolved.withKind(KindSelection.valueOf(kindRaw.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                warn.accept("Unknown DECODER_KIND=" + kindRaw + ", keeping " + resolved.kind());
            }
        }
        return resolved;
    }
}
