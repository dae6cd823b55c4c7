package com.aerodecode.decoder.derive;

import com.aerodecode.core.model.AltimeterSetting;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Numeric derivations attached to decoded groups. The altimeter conversions are the report
 * convention's approximations and are not inverses of each other.
 */
public final class Derivations {
    private static final double MAGNUS_B = 17.625;
    private static final double MAGNUS_C = 243.04;
    private static final double HPA_PER_INHG = 33.8639;

    private Derivations() {
    }

    /**
     * Magnus approximation, rounded to one decimal.
     */
    public static Optional<Double> relativeHumidity(Integer temperature, Integer dewpoint) {
        if (temperature == null || dewpoint == null) {
            return Optional.empty();
        }
        double numerator = Math.exp((MAGNUS_B * dewpoint) / (MAGNUS_C + dewpoint));
        double denominator = Math.exp((MAGNUS_B * temperature) / (MAGNUS_C + temperature));
        return Optional.of(round(100 * numerator / denominator, 1));
    }

    /**
     * {@code A####}: hundredths of inches of mercury.
     */
    public static AltimeterSetting fromInchesOfMercury(int hundredths) {
        double inches = hundredths / 100.0;
        return new AltimeterSetting('A', round(inches * HPA_PER_INHG, 1), inches);
    }

    /**
     * {@code Q####}: whole hectopascals.
     */
    public static AltimeterSetting fromHectopascals(int hectopascals) {
        return new AltimeterSetting('Q', hectopascals, round(hectopascals * 3 / 4.0, 2));
    }

    /**
     * {@code SLPddd}: tenths of hPa with the leading 9 or 10 omitted.
     */
    public static double seaLevelPressure(int tenths) {
        int base = tenths < 500 ? 10000 : 9000;
        return (base + tenths) / 10.0;
    }

    /**
     * Four-digit {@code sTTT} field: sign nibble then tenths of a degree.
     */
    public static double supplementaryTemperature(String field) {
        int sign = field.charAt(0) == '1' ? -1 : 1;
        int whole = Integer.parseInt(field.substring(1, 3));
        int tenths = Integer.parseInt(field.substring(3, 4));
        return sign * (whole * 10 + tenths) / 10.0;
    }

    public static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
