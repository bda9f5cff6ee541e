package com.chicu.aimotuner.tuning.solver;

import com.chicu.aimotuner.tuning.TuningCandidate;
import com.chicu.aimotuner.tuning.eval.Solver;
import com.chicu.aimotuner.tuning.eval.SolverOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Placeholder: всегда один и тот же ответ, прижатый к [0, 99999].
 */
@Slf4j
public class ConstantAnswerSolver implements Solver {

    public static final long MIN_ANSWER = 0L;
    public static final long MAX_ANSWER = 99_999L;

    private final long answer;

    public ConstantAnswerSolver(long answer) {
        this.answer = clamp(answer);
    }

    @Override
    public SolverOutcome solve(String problemId, String problemText, TuningCandidate candidate) {
        long t0 = System.nanoTime();

        Map<String, Object> telemetry = new LinkedHashMap<>();
        telemetry.put("solver", "constant");
        telemetry.put(SolverOutcome.ELAPSED_SEC, (System.nanoTime() - t0) / 1e9);

        log.debug("constant solver: problem={} -> {}", problemId, answer);
        return new SolverOutcome(answer, telemetry);
    }

    static long clamp(long v) {
        return Math.max(MIN_ANSWER, Math.min(MAX_ANSWER, v));
    }
}
