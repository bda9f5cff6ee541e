package com.chicu.aimotuner.tuning.space;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Описание одного параметра: INT [low..high] с шагом, FLOAT [low..high] или CATEGORICAL (choices).
 */
@Builder
public record ParamSpec(
        String name,
        ParamKind kind,
        double low,
        double high,
        Integer step,           // только для INT, null = 1
        List<String> choices    // только для CATEGORICAL
) {

    public ParamSpec {
        if (kind == ParamKind.INT && step == null) {
            step = 1;
        }
        choices = (choices == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(choices));

        ParamSpecValidator.validateOrThrow(name, kind, low, high, step, choices);
    }

    public static ParamSpec intRange(String name, int low, int high) {
        return intRange(name, low, high, 1);
    }

    public static ParamSpec intRange(String name, int low, int high, int step) {
        return new ParamSpec(name, ParamKind.INT, low, high, step, List.of());
    }

    public static ParamSpec floatRange(String name, double low, double high) {
        return new ParamSpec(name, ParamKind.FLOAT, low, high, null, List.of());
    }

    public static ParamSpec categorical(String name, List<String> choices) {
        return new ParamSpec(name, ParamKind.CATEGORICAL, 0, 0, null, choices);
    }

    /**
     * Количество точек сетки INT-параметра: low, low+step, ... (не выше high).
     */
    public long gridSize() {
        if (kind != ParamKind.INT) {
            throw new IllegalStateException("gridSize() is defined only for INT params: " + name);
        }
        return (long) Math.floor((high - low) / step) + 1;
    }

    public int gridValue(long index) {
        return (int) (Math.round(low) + (long) step * index);
    }

    public int maxGridValue() {
        return gridValue(gridSize() - 1);
    }
}
