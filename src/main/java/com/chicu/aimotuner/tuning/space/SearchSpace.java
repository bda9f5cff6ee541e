package com.chicu.aimotuner.tuning.space;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.TuningCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Пространство поиска: упорядоченный набор {@link ParamSpec} + валидация/приведение значений.
 * Без состояния и побочных эффектов.
 */
public final class SearchSpace {

    public static final String K = "k";
    public static final String TEMPERATURE = "temperature";
    public static final String MAX_NEW_TOKENS = "max_new_tokens";
    public static final String PROMPT_STYLE = "prompt_style";
    public static final String SELECTION_STRATEGY = "selection_strategy";
    public static final String TOP_P = "top_p";

    private static final double FLOAT_EPS = 1e-9;

    private final Map<String, ParamSpec> specs;

    private SearchSpace(Map<String, ParamSpec> specs) {
        this.specs = Collections.unmodifiableMap(specs);
    }

    public static SearchSpace of(List<ParamSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("SearchSpace: нет параметров");
        }
        Map<String, ParamSpec> byName = new LinkedHashMap<>();
        for (ParamSpec s : specs) {
            if (s == null) throw new IllegalArgumentException("SearchSpace: ParamSpec is null");
            ParamSpec prev = byName.put(s.name(), s);
            if (prev != null) {
                throw new IllegalArgumentException("SearchSpace: дубль параметра " + s.name());
            }
        }
        return new SearchSpace(byName);
    }

    /**
     * Пространство AIMO-солвера, границы берутся из конфигурации.
     */
    public static SearchSpace fromProperties(TunerProperties.Space p) {
        if (p == null) throw new IllegalArgumentException("SearchSpace: space properties is null");

        return of(List.of(
                ParamSpec.intRange(K, p.getKMin(), p.getKMax()),
                ParamSpec.floatRange(TEMPERATURE, p.getTemperatureMin(), p.getTemperatureMax()),
                ParamSpec.intRange(MAX_NEW_TOKENS, p.getMaxTokensMin(), p.getMaxTokensMax(), p.getMaxTokensStep()),
                ParamSpec.categorical(PROMPT_STYLE, p.getPromptStyles()),
                ParamSpec.categorical(SELECTION_STRATEGY, p.getSelectionStrategies()),
                ParamSpec.floatRange(TOP_P, p.getTopPMin(), p.getTopPMax())
        ));
    }

    public List<ParamSpec> specs() {
        return new ArrayList<>(specs.values());
    }

    public List<String> names() {
        return new ArrayList<>(specs.keySet());
    }

    public int size() {
        return specs.size();
    }

    public ParamSpec get(String name) {
        ParamSpec s = specs.get(name);
        if (s == null) throw new IllegalArgumentException("SearchSpace: неизвестный параметр " + name);
        return s;
    }

    /**
     * Проверить значение, предложенное сэмплером, и привести к каноничному типу.
     *
     * @throws InvalidParameterException если значение вне домена параметра
     */
    public Object draw(String name, Object raw) {
        ParamSpec spec = get(name);
        if (raw == null) {
            throw new InvalidParameterException(name, null, "value is null");
        }

        return switch (spec.kind()) {
            case INT -> drawInt(spec, raw);
            case FLOAT -> drawFloat(spec, raw);
            case CATEGORICAL -> drawCategory(spec, raw);
        };
    }

    /**
     * Собрать кандидата из полного набора значений: каждый объявленный параметр ровно один раз.
     */
    public TuningCandidate candidate(Map<String, ?> raw) {
        if (raw == null) throw new IllegalArgumentException("SearchSpace: raw params is null");

        for (String key : raw.keySet()) {
            if (!specs.containsKey(key)) {
                throw new InvalidParameterException(key, raw.get(key), "parameter is not declared");
            }
        }

        Map<String, Object> params = new LinkedHashMap<>();
        for (ParamSpec s : specs.values()) {
            if (!raw.containsKey(s.name())) {
                throw new InvalidParameterException(s.name(), null, "value is missing");
            }
            params.put(s.name(), draw(s.name(), raw.get(s.name())));
        }
        return TuningCandidate.builder().params(params).build();
    }

    public boolean contains(TuningCandidate candidate) {
        if (candidate == null) return false;
        try {
            candidate(candidate.params());
            return true;
        } catch (InvalidParameterException e) {
            return false;
        }
    }

    // =========================================================
    // helpers
    // =========================================================

    private static Integer drawInt(ParamSpec spec, Object raw) {
        double x = toDouble(spec, raw);

        if (Math.abs(x - Math.rint(x)) > FLOAT_EPS) {
            throw new InvalidParameterException(spec.name(), raw, "not an integer");
        }
        long v = (long) Math.rint(x);
        long low = Math.round(spec.low());

        if (v < low || v > Math.round(spec.high())) {
            throw new InvalidParameterException(spec.name(), raw, "outside [" + low + ", " + Math.round(spec.high()) + "]");
        }
        if ((v - low) % spec.step() != 0) {
            throw new InvalidParameterException(spec.name(), raw, "not on step grid " + spec.step());
        }
        return (int) v;
    }

    private static Double drawFloat(ParamSpec spec, Object raw) {
        double x = toDouble(spec, raw);

        if (x < spec.low() - FLOAT_EPS || x > spec.high() + FLOAT_EPS) {
            throw new InvalidParameterException(spec.name(), raw, "outside [" + spec.low() + ", " + spec.high() + "]");
        }
        // погрешность округления прижимаем к границе
        return Math.min(spec.high(), Math.max(spec.low(), x));
    }

    private static String drawCategory(ParamSpec spec, Object raw) {
        String s = String.valueOf(raw);
        for (String c : spec.choices()) {
            if (c.equals(s)) return c;
        }
        throw new InvalidParameterException(spec.name(), raw, "not one of " + spec.choices());
    }

    private static double toDouble(ParamSpec spec, Object raw) {
        double x;
        if (raw instanceof Number n) {
            x = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                x = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new InvalidParameterException(spec.name(), raw, "not a number");
            }
        } else {
            throw new InvalidParameterException(spec.name(), raw, "unsupported type " + raw.getClass().getSimpleName());
        }

        if (Double.isNaN(x) || Double.isInfinite(x)) {
            throw new InvalidParameterException(spec.name(), raw, "not finite");
        }
        return x;
    }
}
