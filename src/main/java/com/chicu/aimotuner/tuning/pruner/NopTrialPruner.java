package com.chicu.aimotuner.tuning.pruner;

import com.chicu.aimotuner.tuning.study.Study;
import com.chicu.aimotuner.tuning.study.TrialProgress;

public class NopTrialPruner implements TrialPruner {

    @Override
    public PruneDecision check(Study study, TrialProgress trial) {
        return PruneDecision.keep("pruning disabled");
    }
}
