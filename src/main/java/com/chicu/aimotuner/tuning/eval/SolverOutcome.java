package com.chicu.aimotuner.tuning.eval;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Builder
public record SolverOutcome(
        long answer,
        Map<String, Object> telemetry   // минимум elapsed_sec
) {
    public static final String ELAPSED_SEC = "elapsed_sec";

    public SolverOutcome {
        telemetry = (telemetry == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(telemetry));
    }

    public static SolverOutcome of(long answer, double elapsedSec) {
        return new SolverOutcome(answer, Map.of(ELAPSED_SEC, elapsedSec));
    }

    /**
     * elapsed_sec из телеметрии; 0, если нет, не число или отрицательное.
     */
    public double elapsedSec() {
        Object v = telemetry.get(ELAPSED_SEC);
        if (v instanceof Number n) {
            double x = n.doubleValue();
            return (Double.isFinite(x) && x > 0.0) ? x : 0.0;
        }
        return 0.0;
    }
}
