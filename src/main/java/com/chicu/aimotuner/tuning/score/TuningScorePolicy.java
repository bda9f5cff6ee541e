package com.chicu.aimotuner.tuning.score;

import com.chicu.aimotuner.tuning.eval.EvaluationMetrics;

public interface TuningScorePolicy {

    double score(EvaluationMetrics metrics);
}
