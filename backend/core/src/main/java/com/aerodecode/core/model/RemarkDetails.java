package com.aerodecode.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values resolved from the METAR remarks section. Absent groups are {@code null}.
 */
public record RemarkDetails(
        String stationType,
        Double seaLevelPressure,
        List<Double> supplementaryTemperatures,
        Integer fieldPressureMmHg,
        Integer fieldPressureHpa
) {
    public static final RemarkDetails NONE = new RemarkDetails(null, null, null, null, null);

    public RemarkDetails {
        supplementaryTemperatures = supplementaryTemperatures == null ? null : List.copyOf(supplementaryTemperatures);
    }

    public boolean hasAny() {
        return !describe().isEmpty();
    }

    /**
     * Description to value projection, in a fixed order.
     */
    public Map<String, Object> describe() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (stationType != null) {
            details.put("тип станции", stationType);
        }
        if (seaLevelPressure != null) {
            details.put("давление на уровне моря (гПа)", seaLevelPressure);
        }
        if (supplementaryTemperatures != null) {
            details.put("дополнительные температуры", supplementaryTemperatures);
        }
        if (fieldPressureMmHg != null) {
            details.put("давление на уровне аэродрома (мм рт. ст.)", fieldPressureMmHg);
        }
        if (fieldPressureHpa != null) {
            details.put("давление на уровне аэродрома (гПа)", fieldPressureHpa);
        }
        return details;
    }
}
