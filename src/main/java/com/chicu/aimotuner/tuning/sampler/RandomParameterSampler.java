package com.chicu.aimotuner.tuning.sampler;

import com.chicu.aimotuner.tuning.TuningCandidate;
import com.chicu.aimotuner.tuning.space.ParamSpec;
import com.chicu.aimotuner.tuning.space.SearchSpace;
import com.chicu.aimotuner.tuning.study.Study;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Равномерный сэмплинг каждого параметра независимо.
 */
public class RandomParameterSampler implements ParameterSampler {

    private final SearchSpace space;
    private final long seed;

    public RandomParameterSampler(SearchSpace space, long seed) {
        if (space == null) throw new IllegalArgumentException("SearchSpace is null");
        this.space = space;
        this.seed = seed;
    }

    @Override
    public TuningCandidate propose(Study study, int trialNumber) {
        Random rnd = trialRandom(seed, trialNumber);
        Map<String, Object> params = new LinkedHashMap<>();

        for (ParamSpec spec : space.specs()) {
            params.put(spec.name(), space.draw(spec.name(), drawUniform(spec, rnd)));
        }

        return TuningCandidate.builder().params(params).build();
    }

    static Object drawUniform(ParamSpec spec, Random rnd) {
        return switch (spec.kind()) {
            case INT -> spec.gridValue(nextLongInclusive(rnd, 0, spec.gridSize() - 1));
            case FLOAT -> spec.low() + rnd.nextDouble() * (spec.high() - spec.low());
            case CATEGORICAL -> spec.choices().get(rnd.nextInt(spec.choices().size()));
        };
    }

    /**
     * Свой Random на каждый trial: (seed, trialNumber) -> независимый поток.
     */
    static Random trialRandom(long seed, int trialNumber) {
        long z = seed + 0x9E3779B97F4A7C15L * (trialNumber + 1L);
        // splitmix64 finalizer
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return new Random(z ^ (z >>> 31));
    }

    static long nextLongInclusive(Random rnd, long min, long max) {
        if (max < min) throw new IllegalArgumentException("nextLongInclusive: max < min");
        if (max == min) return min;

        long bound = (max - min) + 1;
        return min + nextLongBounded(rnd, bound);
    }

    private static long nextLongBounded(Random rnd, long bound) {
        // аналог Random#nextInt(bound), но для long
        if (bound <= 0) throw new IllegalArgumentException("bound must be positive");

        long r = rnd.nextLong();
        long m = bound - 1;

        if ((bound & m) == 0L) { // power of two
            return r & m;
        }

        long u = r >>> 1;
        while (u + m - (u % bound) < 0L) {
            u = (rnd.nextLong() >>> 1);
        }
        return u % bound;
    }
}
