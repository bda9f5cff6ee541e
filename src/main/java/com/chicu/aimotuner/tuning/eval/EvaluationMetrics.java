package com.chicu.aimotuner.tuning.eval;

import lombok.Builder;

@Builder
public record EvaluationMetrics(
        int correct,
        int problems,
        double totalElapsedSec
) {
    public EvaluationMetrics {
        if (problems <= 0) throw new IllegalArgumentException("EvaluationMetrics: problems <= 0");
        if (correct < 0 || correct > problems) {
            throw new IllegalArgumentException("EvaluationMetrics: correct " + correct + " not in [0, " + problems + "]");
        }
    }

    public double accuracy() {
        return (double) correct / problems;
    }

    public double avgTimeSec() {
        return totalElapsedSec / problems;
    }
}
