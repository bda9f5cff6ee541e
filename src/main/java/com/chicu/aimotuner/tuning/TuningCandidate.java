package com.chicu.aimotuner.tuning;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Один конкретный набор гиперпараметров (ключ -> значение).
 * Значения: Integer / Double / String. После создания не меняется.
 */
@Builder
public record TuningCandidate(
        Map<String, Object> params
) {

    public TuningCandidate {
        params = (params == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static TuningCandidate empty() {
        return new TuningCandidate(Map.of());
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    public Object get(String name) {
        return params.get(name);
    }

    public int intParam(String name) {
        Object v = must(name);
        if (v instanceof Number n) return n.intValue();
        throw new IllegalStateException("Param " + name + " is not numeric: " + v);
    }

    public double doubleParam(String name) {
        Object v = must(name);
        if (v instanceof Number n) return n.doubleValue();
        throw new IllegalStateException("Param " + name + " is not numeric: " + v);
    }

    public String stringParam(String name) {
        return String.valueOf(must(name));
    }

    private Object must(String name) {
        Object v = params.get(name);
        if (v == null) throw new IllegalStateException("Param " + name + " is missing");
        return v;
    }
}
