package com.chicu.aimotuner.tuning.eval;

import com.chicu.aimotuner.tuning.TuningCandidate;

public interface Solver {

    /**
     * Решить задачу с заданными гиперпараметрами.
     * Блокирующий вызов; должен вернуться за конечное время или бросить исключение.
     */
    SolverOutcome solve(String problemId, String problemText, TuningCandidate candidate);
}
