package com.aerodecode.decoder.token;

import java.util.Arrays;
import java.util.List;

public final class ReportTokenizer {
    public static final String REMARKS_MARKER = "RMK";
    private static final String TERMINATOR = "=";

    private ReportTokenizer() {
    }

    /**
     * Splits a report on whitespace after removing one trailing {@code =} terminator.
     */
    public static List<String> words(String raw) {
        String text = stripTerminator(raw);
        if (text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\\s+"));
    }

    /**
     * Separates the body from the remarks at the first standalone {@code RMK} word.
     */
    public static TokenizedReport tokenize(String raw) {
        List<String> words = words(raw);
        int marker = words.indexOf(REMARKS_MARKER);
        if (marker < 0) {
            return new TokenizedReport(words, List.of());
        }
        return new TokenizedReport(words.subList(0, marker), words.subList(marker + 1, words.size()));
    }

    /**
     * Whitespace-normalized report text, used where a grammar spans several tokens.
     */
    public static String normalize(String raw) {
        return String.join(" ", words(raw));
    }

    static String stripTerminator(String raw) {
        String text = raw.strip();
        if (text.endsWith(TERMINATOR)) {
            text = text.substring(0, text.length() - TERMINATOR.length()).strip();
        }
        return text;
    }
}
