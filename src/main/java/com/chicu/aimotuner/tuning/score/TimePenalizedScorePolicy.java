package com.chicu.aimotuner.tuning.score;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.eval.EvaluationMetrics;
import lombok.Getter;

/**
 * score = accuracy - weight * timePenalty,
 * timePenalty = min(cap, max(0, (avgTime - budget) / budget) ^ exponent).
 * По умолчанию exponent = 1, cap нет.
 */
@Getter
public class TimePenalizedScorePolicy implements TuningScorePolicy {

    private final double timeBudgetPerProblem;
    private final double timePenaltyWeight;
    private final double penaltyExponent;
    private final Double penaltyCap;

    public TimePenalizedScorePolicy(double timeBudgetPerProblem, double timePenaltyWeight) {
        this(timeBudgetPerProblem, timePenaltyWeight, 1.0, null);
    }

    public TimePenalizedScorePolicy(double timeBudgetPerProblem,
                                    double timePenaltyWeight,
                                    double penaltyExponent,
                                    Double penaltyCap) {
        if (!(timeBudgetPerProblem > 0)) {
            throw new IllegalArgumentException("Score: timeBudgetPerProblem must be > 0");
        }
        if (timePenaltyWeight < 0) {
            throw new IllegalArgumentException("Score: timePenaltyWeight < 0");
        }
        if (!(penaltyExponent > 0)) {
            throw new IllegalArgumentException("Score: penaltyExponent must be > 0");
        }
        if (penaltyCap != null && penaltyCap < 0) {
            throw new IllegalArgumentException("Score: penaltyCap < 0");
        }
        this.timeBudgetPerProblem = timeBudgetPerProblem;
        this.timePenaltyWeight = timePenaltyWeight;
        this.penaltyExponent = penaltyExponent;
        this.penaltyCap = penaltyCap;
    }

    public static TimePenalizedScorePolicy fromProperties(TunerProperties.Score p) {
        return new TimePenalizedScorePolicy(
                p.getTimeBudgetPerProblem(),
                p.getTimePenaltyWeight(),
                p.getPenaltyExponent(),
                p.getPenaltyCap()
        );
    }

    @Override
    public double score(EvaluationMetrics metrics) {
        return metrics.accuracy() - timePenaltyWeight * timePenalty(metrics.avgTimeSec());
    }

    public double timePenalty(double avgTimeSec) {
        double over = Math.max(0.0, (avgTimeSec - timeBudgetPerProblem) / timeBudgetPerProblem);
        double shaped = (penaltyExponent == 1.0) ? over : Math.pow(over, penaltyExponent);
        return (penaltyCap != null) ? Math.min(penaltyCap, shaped) : shaped;
    }
}
