package com.aerodecode.decoder.metar;

import com.aerodecode.core.model.RemarkDetails;
import com.aerodecode.decoder.derive.Derivations;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Remarks mini-grammar. Unknown remark tokens are left in the remarks text only.
 */
public final class RemarksParser {
    private static final Pattern STATION_TYPE = Pattern.compile("^AO[12]$");
    private static final Pattern SEA_LEVEL_PRESSURE = Pattern.compile("^SLP(\\d{3})$");
    private static final Pattern SUPPLEMENTARY_TEMPERATURE = Pattern.compile("^T(\\d{4})(\\d{4})?$");
    private static final Pattern FIELD_PRESSURE = Pattern.compile("^QFE(\\d{3})(?:/(\\d{4}))?$");

    private RemarksParser() {
    }

    public static RemarkDetails parse(List<String> tokens) {
        String stationType = null;
        Double seaLevelPressure = null;
        List<Double> temperatures = null;
        Integer fieldPressureMmHg = null;
        Integer fieldPressureHpa = null;

        for (String token : tokens) {
            if (STATION_TYPE.matcher(token).matches()) {
                stationType = token;
                continue;
            }
            Matcher slp = SEA_LEVEL_PRESSURE.matcher(token);
            if (slp.matches()) {
                seaLevelPressure = Derivations.seaLevelPressure(Integer.parseInt(slp.group(1)));
                continue;
            }
            Matcher temperature = SUPPLEMENTARY_TEMPERATURE.matcher(token);
            if (temperature.matches()) {
                temperatures = new ArrayList<>();
                temperatures.add(Derivations.supplementaryTemperature(temperature.group(1)));
                if (temperature.group(2) != null) {
                    temperatures.add(Derivations.supplementaryTemperature(temperature.group(2)));
                }
                continue;
            }
            Matcher qfe = FIELD_PRESSURE.matcher(token);
            if (qfe.matches()) {
                fieldPressureMmHg = Integer.parseInt(qfe.group(1));
                fieldPressureHpa = qfe.group(2) == null ? null : Integer.parseInt(qfe.group(2));
            }
        }
        return new RemarkDetails(stationType, seaLevelPressure, temperatures, fieldPressureMmHg, fieldPressureHpa);
    }
}
