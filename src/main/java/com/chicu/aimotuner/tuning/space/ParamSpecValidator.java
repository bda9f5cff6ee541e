package com.chicu.aimotuner.tuning.space;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ParamSpecValidator {

    private ParamSpecValidator() {}

    public static void validateOrThrow(String name,
                                       ParamKind kind,
                                       double low,
                                       double high,
                                       Integer step,
                                       List<String> choices) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("ParamSpec: name пустой");
        }
        if (kind == null) {
            throw new IllegalArgumentException("ParamSpec: kind не задан для " + name);
        }

        if (kind == ParamKind.CATEGORICAL) {
            if (choices == null || choices.isEmpty()) {
                throw new IllegalArgumentException("ParamSpec: пустой список choices для " + name);
            }
            Set<String> seen = new HashSet<>();
            for (String c : choices) {
                if (c == null) {
                    throw new IllegalArgumentException("ParamSpec: null в choices для " + name);
                }
                if (!seen.add(c)) {
                    throw new IllegalArgumentException("ParamSpec: дубль '" + c + "' в choices для " + name);
                }
            }
            return;
        }

        if (Double.isNaN(low) || Double.isNaN(high) || Double.isInfinite(low) || Double.isInfinite(high)) {
            throw new IllegalArgumentException("ParamSpec: low/high должны быть конечными для " + name);
        }
        if (low > high) {
            throw new IllegalArgumentException("ParamSpec: low > high для " + name);
        }

        // Для INT: low/high целые, step > 0.
        if (kind == ParamKind.INT) {
            if (low != Math.rint(low) || high != Math.rint(high)) {
                throw new IllegalArgumentException("ParamSpec: INT параметр требует целые low/high: " + name);
            }
            if (step == null || step <= 0) {
                throw new IllegalArgumentException("ParamSpec: step <= 0 для " + name);
            }
        }
    }
}
