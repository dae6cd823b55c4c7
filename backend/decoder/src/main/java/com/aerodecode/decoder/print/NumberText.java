package com.aerodecode.decoder.print;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

final class NumberText {
    private NumberText() {
    }

    /**
     * Whole values without a fraction, others in their shortest decimal form.
     */
    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String format(Object value) {
        if (value instanceof Double) {
            return format(((Double) value).doubleValue());
        }
        if (value instanceof List<?>) {
            return ((List<?>) value).stream().map(NumberText::format).collect(Collectors.joining(", "));
        }
        return String.valueOf(value);
    }
}
