package com.chicu.aimotuner.tuning.sampler;

import java.util.Arrays;
import java.util.Random;

/**
 * Одномерная плотность: смесь усечённых на [low, high] гауссиан,
 * по одной на наблюдение + априорная компонента по центру диапазона.
 */
final class ParzenEstimator {

    private static final double MIN_MASS = 1e-12;
    private static final int MAX_REJECTIONS = 100;

    private final double low;
    private final double high;

    private final double[] mus;
    private final double[] sigmas;
    private final double[] weights;   // нормированы, сумма = 1
    private final double[] masses;    // масса каждой гауссианы внутри [low, high]

    ParzenEstimator(double[] observations, double low, double high, double priorWeight) {
        if (low > high) throw new IllegalArgumentException("ParzenEstimator: low > high");
        if (priorWeight <= 0) throw new IllegalArgumentException("ParzenEstimator: priorWeight <= 0");

        this.low = low;
        this.high = high;

        double range = Math.max(high - low, MIN_MASS);
        int n = observations.length;

        // наблюдения + prior, отсортированы по mu
        double[][] comps = new double[n + 1][3]; // {mu, weight, prior?}
        for (int i = 0; i < n; i++) {
            comps[i][0] = observations[i];
            comps[i][1] = 1.0;
        }
        comps[n][0] = low + range / 2.0;
        comps[n][1] = priorWeight;
        comps[n][2] = 1.0;
        Arrays.sort(comps, (a, b) -> Double.compare(a[0], b[0]));

        int size = n + 1;
        mus = new double[size];
        sigmas = new double[size];
        weights = new double[size];
        masses = new double[size];

        double totalWeight = 0;
        for (int i = 0; i < size; i++) {
            mus[i] = comps[i][0];
            totalWeight += comps[i][1];
        }

        // ширина: расстояние до дальнего из соседей (границы диапазона тоже считаются соседями)
        double minSigma = range / Math.min(100.0, 1.0 + size);
        for (int i = 0; i < size; i++) {
            double left = mus[i] - (i > 0 ? mus[i - 1] : low);
            double right = (i < size - 1 ? mus[i + 1] : high) - mus[i];
            double s = Math.max(left, right);

            boolean prior = comps[i][2] > 0;
            sigmas[i] = prior ? range : Math.min(range, Math.max(minSigma, s));

            weights[i] = comps[i][1] / totalWeight;
            masses[i] = Math.max(MIN_MASS,
                    normalCdf((high - mus[i]) / sigmas[i]) - normalCdf((low - mus[i]) / sigmas[i]));
        }
    }

    double sample(Random rnd) {
        int c = pickComponent(rnd);
        if (high - low <= 0) return low;

        for (int i = 0; i < MAX_REJECTIONS; i++) {
            double x = mus[c] + sigmas[c] * rnd.nextGaussian();
            if (x >= low && x <= high) return x;
        }
        return low + rnd.nextDouble() * (high - low);
    }

    double logPdf(double x) {
        if (x < low || x > high) return Double.NEGATIVE_INFINITY;

        double[] terms = new double[mus.length];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < mus.length; i++) {
            double z = (x - mus[i]) / sigmas[i];
            terms[i] = Math.log(weights[i])
                    - 0.5 * z * z
                    - Math.log(sigmas[i] * Math.sqrt(2 * Math.PI))
                    - Math.log(masses[i]);
            max = Math.max(max, terms[i]);
        }
        if (max == Double.NEGATIVE_INFINITY) return max;

        double sum = 0;
        for (double t : terms) sum += Math.exp(t - max);
        return max + Math.log(sum);
    }

    private int pickComponent(Random rnd) {
        double u = rnd.nextDouble();
        double acc = 0;
        for (int i = 0; i < weights.length; i++) {
            acc += weights[i];
            if (u < acc) return i;
        }
        return weights.length - 1;
    }

    static double normalCdf(double z) {
        return 0.5 * (1.0 + erf(z / Math.sqrt(2.0)));
    }

    // Abramowitz & Stegun 7.1.26, |ошибка| < 1.5e-7
    private static double erf(double x) {
        double sign = Math.signum(x);
        double ax = Math.abs(x);
        double t = 1.0 / (1.0 + 0.3275911 * ax);
        double y = 1.0 - (((((1.061405429 * t - 1.453152027) * t) + 1.421413741) * t - 0.284496736) * t + 0.254829592)
                * t * Math.exp(-ax * ax);
        return sign * y;
    }
}
