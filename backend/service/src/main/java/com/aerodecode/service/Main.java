package com.aerodecode.service;

import com.aerodecode.decoder.ReportDecoder;
import com.aerodecode.service.config.ConfigLoader;
import com.aerodecode.service.config.DecoderConfig;
import com.aerodecode.service.runtime.DecodeRunner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Decodes the report given as arguments, or a bulletin read from standard input.
 */
public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws IOException {
        Path configDir = Path.of("config");
        DecoderConfig config = ConfigLoader.applyEnvironment(
                ConfigLoader.loadDecoder(configDir),
                System.getenv(),
                LOGGER::warning
        );

        String input = args.length > 0
                ? String.join(" ", args)
                : new String(System.in.readAllBytes(), StandardCharsets.UTF_8);

        List<String> outputs = new DecodeRunner(new ReportDecoder(), config).run(input);
        System.out.println(String.join(System.lineSeparator() + System.lineSeparator(), outputs));
    }
}
