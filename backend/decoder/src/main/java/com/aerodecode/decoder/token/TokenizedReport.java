package com.aerodecode.decoder.token;

import java.util.List;

/**
 * Main-body tokens and the remarks section of one report, in report order.
 */
public record TokenizedReport(List<String> body, List<String> remarkTokens) {
    public TokenizedReport {
        body = List.copyOf(body);
        remarkTokens = List.copyOf(remarkTokens);
    }

    public String remarks() {
        return String.join(" ", remarkTokens);
    }

    public boolean hasRemarks() {
        return !remarkTokens.isEmpty();
    }
}
