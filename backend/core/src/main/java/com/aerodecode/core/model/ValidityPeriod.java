package com.aerodecode.core.model;

import java.util.Objects;

public record ValidityPeriod(DayHour from, DayHour to) {
    public ValidityPeriod {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
    }
}
