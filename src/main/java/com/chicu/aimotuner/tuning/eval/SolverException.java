package com.chicu.aimotuner.tuning.eval;

import lombok.Getter;

@Getter
public class SolverException extends RuntimeException {

    private final String problemId;

    public SolverException(String problemId, String message, Throwable cause) {
        super("Solver failed on problem " + problemId + ": " + message, cause);
        this.problemId = problemId;
    }
}
