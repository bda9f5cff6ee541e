package com.chicu.aimotuner.tuning.study;

import lombok.Getter;

import java.util.List;

/**
 * Бюджет исчерпан, а ни один trial не завершился COMPLETE, "лучшего" нет.
 * solverErrors: почему падали trial'ы ("trial #N: ...").
 */
@Getter
public class EmptyStudyException extends RuntimeException {

    private final String studyName;
    private final int trials;
    private final int pruned;
    private final int failed;
    private final List<String> solverErrors;

    public EmptyStudyException(String studyName, int trials, int pruned, int failed, List<String> solverErrors) {
        super("Study " + studyName + " has no completed trials (trials=" + trials
                + ", pruned=" + pruned + ", failed=" + failed + ")"
                + ((solverErrors == null || solverErrors.isEmpty()) ? "" : ", last error: " + solverErrors.get(solverErrors.size() - 1)));
        this.studyName = studyName;
        this.trials = trials;
        this.pruned = pruned;
        this.failed = failed;
        this.solverErrors = (solverErrors == null) ? List.of() : List.copyOf(solverErrors);
    }
}
