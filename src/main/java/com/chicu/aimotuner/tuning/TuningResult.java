package com.chicu.aimotuner.tuning;

import com.chicu.aimotuner.tuning.study.StopReason;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Слепок итогов study на момент окончания запуска; это и пишется в ConfigStore.
 */
@Builder
public record TuningResult(
        @JsonProperty("best_config") Map<String, Object> bestConfig,
        @JsonProperty("best_score") double bestScore,
        @JsonProperty("n_trials") int trialCount,

        @JsonProperty("n_complete") int completeTrials,
        @JsonProperty("n_pruned") int prunedTrials,
        @JsonProperty("n_failed") int failedTrials,
        @JsonProperty("solver_errors") List<String> solverErrors,

        @JsonProperty("mode") String mode,
        @JsonProperty("stop_reason") StopReason stopReason,
        @JsonProperty("timestamp") String timestamp     // yyyy-MM-dd HH:mm:ss
) {
    public TuningResult {
        bestConfig = (bestConfig == null) ? Map.of() : bestConfig;
        solverErrors = (solverErrors == null) ? List.of() : List.copyOf(solverErrors);
    }
}
