package com.chicu.aimotuner.tuning.eval;

import lombok.Builder;

@Builder
public record Problem(
        String id,
        String problem,
        long answer
) {
    public Problem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Problem: id пустой");
        }
        if (problem == null) {
            throw new IllegalArgumentException("Problem: text is null for " + id);
        }
    }
}
