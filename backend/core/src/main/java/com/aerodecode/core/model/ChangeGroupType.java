package com.aerodecode.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum ChangeGroupType {
    BECMG("BECMG"),
    TEMPO("TEMPO"),
    PROB30("PROB30"),
    PROB40("PROB40"),
    PROB30_TEMPO("PROB30 TEMPO"),
    PROB40_TEMPO("PROB40 TEMPO"),
    FM("FM");

    private final String label;

    ChangeGroupType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean probability() {
        return this == PROB30 || this == PROB40;
    }

    /**
     * The compound type a probability group becomes when immediately followed by {@code TEMPO}.
     */
    public ChangeGroupType withTempo() {
        if (this == PROB30) {
            return PROB30_TEMPO;
        }
        if (this == PROB40) {
            return PROB40_TEMPO;
        }
        throw new IllegalStateException(label + " cannot be combined with TEMPO");
    }

    public static Optional<ChangeGroupType> fromLabel(String label) {
        for (ChangeGroupType type : values()) {
            if (type.label.equals(label)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
