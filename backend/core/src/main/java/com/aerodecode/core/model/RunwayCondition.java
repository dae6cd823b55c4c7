package com.aerodecode.core.model;

/**
 * Runway state group {@code Rnn/TEddBB}. Each field keeps its raw code; {@code /} and {@code //} mean not reported.
 */
public record RunwayCondition(String runway, String contamination, String extent, String depth, String friction) {
}
