package com.chicu.aimotuner.tuning.sampler;

import com.chicu.aimotuner.tuning.TuningCandidate;
import com.chicu.aimotuner.tuning.space.ParamSpec;
import com.chicu.aimotuner.tuning.space.SearchSpace;
import com.chicu.aimotuner.tuning.study.Study;
import com.chicu.aimotuner.tuning.study.Trial;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Tree-structured Parzen Estimator, по каждому параметру независимо
 * (взаимодействия параметров не моделируются).
 * Пока COMPLETE trial'ов меньше startupTrials, сэмплинг равномерный.
 */
@Slf4j
public class TpeParameterSampler implements ParameterSampler {

    private final SearchSpace space;
    private final long seed;
    private final int startupTrials;
    private final double gamma;
    private final int candidates;
    private final double priorWeight;

    private final RandomParameterSampler uniform;

    public TpeParameterSampler(SearchSpace space,
                               long seed,
                               int startupTrials,
                               double gamma,
                               int candidates,
                               double priorWeight) {
        if (space == null) throw new IllegalArgumentException("SearchSpace is null");
        if (startupTrials < 0) throw new IllegalArgumentException("TPE: startupTrials < 0");
        if (!(gamma > 0 && gamma <= 1)) throw new IllegalArgumentException("TPE: gamma must be in (0, 1]");
        if (candidates <= 0) throw new IllegalArgumentException("TPE: candidates <= 0");
        if (!(priorWeight > 0)) throw new IllegalArgumentException("TPE: priorWeight <= 0");

        this.space = space;
        this.seed = seed;
        this.startupTrials = (startupTrials == 0) ? space.size() : startupTrials;
        this.gamma = gamma;
        this.candidates = candidates;
        this.priorWeight = priorWeight;
        this.uniform = new RandomParameterSampler(space, seed);
    }

    public int getStartupTrials() {
        return startupTrials;
    }

    @Override
    public TuningCandidate propose(Study study, int trialNumber) {
        List<Trial> completed = new ArrayList<>(study.completedTrials());

        if (completed.size() < startupTrials) {
            log.debug("TPE startup: completed={} < {}, uniform draw for trial #{}",
                    completed.size(), startupTrials, trialNumber);
            return uniform.propose(study, trialNumber);
        }

        completed.sort(Comparator
                .comparingDouble((Trial t) -> t.getScore()).reversed()
                .thenComparingInt(Trial::getNumber));

        int nGood = Math.max(1, (int) Math.ceil(gamma * completed.size()));
        List<Trial> good = completed.subList(0, nGood);
        List<Trial> bad = completed.subList(nGood, completed.size());

        Random rnd = RandomParameterSampler.trialRandom(seed, trialNumber);
        Map<String, Object> params = new LinkedHashMap<>();

        for (ParamSpec spec : space.specs()) {
            Object raw = switch (spec.kind()) {
                case INT -> proposeInt(spec, good, bad, rnd);
                case FLOAT -> proposeFloat(spec, good, bad, rnd);
                case CATEGORICAL -> proposeCategory(spec, good, bad, rnd);
            };
            params.put(spec.name(), space.draw(spec.name(), raw));
        }

        log.debug("TPE trial #{}: good={} bad={} -> {}", trialNumber, good.size(), bad.size(), params);
        return TuningCandidate.builder().params(params).build();
    }

    // =========================================================
    // numeric
    // =========================================================

    private Double proposeFloat(ParamSpec spec, List<Trial> good, List<Trial> bad, Random rnd) {
        if (spec.high() <= spec.low()) return spec.low();

        ParzenEstimator l = new ParzenEstimator(observed(spec, good), spec.low(), spec.high(), priorWeight);
        ParzenEstimator g = new ParzenEstimator(observed(spec, bad), spec.low(), spec.high(), priorWeight);

        double best = Double.NaN;
        double bestRatio = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < candidates; i++) {
            double x = l.sample(rnd);
            double ratio = l.logPdf(x) - g.logPdf(x);
            if (Double.isNaN(best) || ratio > bestRatio) {
                best = x;
                bestRatio = ratio;
            }
        }
        return best;
    }

    private Integer proposeInt(ParamSpec spec, List<Trial> good, List<Trial> bad, Random rnd) {
        long size = spec.gridSize();
        if (size == 1) return spec.gridValue(0);

        // модель на непрерывном [low - step/2, high + step/2], потом прижимаем к сетке
        double half = spec.step() / 2.0;
        double low = spec.low() - half;
        double high = spec.maxGridValue() + half;

        ParzenEstimator l = new ParzenEstimator(observed(spec, good), low, high, priorWeight);
        ParzenEstimator g = new ParzenEstimator(observed(spec, bad), low, high, priorWeight);

        int best = spec.gridValue(0);
        double bestRatio = Double.NEGATIVE_INFINITY;
        boolean first = true;
        for (int i = 0; i < candidates; i++) {
            int v = snap(spec, l.sample(rnd));
            double ratio = l.logPdf(v) - g.logPdf(v);
            if (first || ratio > bestRatio) {
                best = v;
                bestRatio = ratio;
                first = false;
            }
        }
        return best;
    }

    private static int snap(ParamSpec spec, double x) {
        long j = Math.round((x - spec.low()) / spec.step());
        j = Math.max(0, Math.min(spec.gridSize() - 1, j));
        return spec.gridValue(j);
    }

    private static double[] observed(ParamSpec spec, List<Trial> trials) {
        List<Double> out = new ArrayList<>(trials.size());
        for (Trial t : trials) {
            Object v = t.getCandidate().get(spec.name());
            if (v instanceof Number n) out.add(n.doubleValue());
        }
        double[] arr = new double[out.size()];
        for (int i = 0; i < arr.length; i++) arr[i] = out.get(i);
        return arr;
    }

    // =========================================================
    // categorical
    // =========================================================

    private String proposeCategory(ParamSpec spec, List<Trial> good, List<Trial> bad, Random rnd) {
        List<String> choices = spec.choices();
        double[] l = frequencies(spec, good);
        double[] g = frequencies(spec, bad);

        int best = -1;
        double bestRatio = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < candidates; i++) {
            int c = pickWeighted(l, rnd);
            double ratio = l[c] / g[c];
            if (best < 0 || ratio > bestRatio) {
                best = c;
                bestRatio = ratio;
            }
        }
        return choices.get(best);
    }

    /**
     * Сглаженные относительные частоты: (count + priorWeight) / sum.
     */
    private double[] frequencies(ParamSpec spec, List<Trial> trials) {
        List<String> choices = spec.choices();
        double[] w = new double[choices.size()];
        for (int i = 0; i < w.length; i++) w[i] = priorWeight;

        for (Trial t : trials) {
            Object v = t.getCandidate().get(spec.name());
            int idx = (v == null) ? -1 : choices.indexOf(String.valueOf(v));
            if (idx >= 0) w[idx] += 1.0;
        }

        double sum = 0;
        for (double x : w) sum += x;
        for (int i = 0; i < w.length; i++) w[i] /= sum;
        return w;
    }

    private static int pickWeighted(double[] p, Random rnd) {
        double u = rnd.nextDouble();
        double acc = 0;
        for (int i = 0; i < p.length; i++) {
            acc += p[i];
            if (u < acc) return i;
        }
        return p.length - 1;
    }
}
