package com.chicu.aimotuner.tuning.pruner;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.study.Study;
import com.chicu.aimotuner.tuning.study.TrialProgress;

public interface TrialPruner {

    /**
     * Решение после очередного промежуточного отчёта running-trial'а.
     * Study только читается; состояние trial'а меняет вызывающий evaluator.
     */
    PruneDecision check(Study study, TrialProgress trial);

    static TrialPruner fromProperties(TunerProperties.Pruner props) {
        if (props == null || !props.isEnabled()) {
            return new NopTrialPruner();
        }
        return new MedianTrialPruner(props.getStartupTrials(), props.getWarmupSteps());
    }
}
