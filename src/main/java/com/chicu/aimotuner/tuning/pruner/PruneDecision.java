package com.chicu.aimotuner.tuning.pruner;

import lombok.Builder;

@Builder
public record PruneDecision(
        boolean prune,
        String reason
) {
    public static PruneDecision keep(String reason) {
        return PruneDecision.builder().prune(false).reason(reason).build();
    }

    public static PruneDecision prune(String reason) {
        return PruneDecision.builder().prune(true).reason(reason).build();
    }
}
