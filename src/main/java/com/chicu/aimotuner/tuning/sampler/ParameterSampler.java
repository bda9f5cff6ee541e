package com.chicu.aimotuner.tuning.sampler;

import com.chicu.aimotuner.tuning.TuningCandidate;
import com.chicu.aimotuner.tuning.study.Study;

public interface ParameterSampler {

    /**
     * Предложить кандидата для trial'а trialNumber по истории study.
     * Одинаковый seed + одинаковая история = одинаковый результат.
     */
    TuningCandidate propose(Study study, int trialNumber);
}
