package com.chicu.aimotuner.tuning.eval;

import com.chicu.aimotuner.tuning.pruner.PruneDecision;
import com.chicu.aimotuner.tuning.pruner.TrialPruner;
import com.chicu.aimotuner.tuning.score.TuningScorePolicy;
import com.chicu.aimotuner.tuning.study.CancellationToken;
import com.chicu.aimotuner.tuning.study.Study;
import com.chicu.aimotuner.tuning.study.Trial;
import com.chicu.aimotuner.tuning.study.TrialState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * Прогон одного кандидата по всему набору задач:
 * running accuracy -> pruner после каждой задачи, в конце штрафованный score.
 */
@Slf4j
@RequiredArgsConstructor
public class ObjectiveEvaluator {

    public static final String INTERRUPTED = "interrupted";
    public static final String TIMEOUT = "timeout";

    private final TrialPruner pruner;
    private final TuningScorePolicy scorePolicy;
    private final Clock clock;

    public TrialState evaluate(Study study,
                               Trial trial,
                               ProblemSet problems,
                               Solver solver,
                               CancellationToken cancellation) {
        return evaluate(study, trial, problems, solver, cancellation, null);
    }

    /**
     * Доводит trial до терминального состояния и возвращает его.
     * Study при этом не меняется: результат фиксирует вызывающий.
     * Дедлайн проверяется между задачами, как и отмена: после дедлайна
     * trial обрезается с причиной {@link #TIMEOUT}.
     *
     * @param deadline null = без ограничения по времени
     */
    public TrialState evaluate(Study study,
                               Trial trial,
                               ProblemSet problems,
                               Solver solver,
                               CancellationToken cancellation,
                               Instant deadline) {

        int correct = 0;
        double totalElapsed = 0.0;

        for (int idx = 0; idx < problems.size(); idx++) {

            if (cancellation != null && cancellation.isCancelled()) {
                log.warn("⛔ TRIAL #{} interrupted at problem {}/{}", trial.getNumber(), idx, problems.size());
                trial.prune(INTERRUPTED, clock.instant());
                return trial.getState();
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                log.warn("⏱️ TRIAL #{} timed out at problem {}/{}", trial.getNumber(), idx, problems.size());
                trial.prune(TIMEOUT, clock.instant());
                return trial.getState();
            }

            Problem p = problems.get(idx);
            SolverOutcome out;
            try {
                out = solver.solve(p.id(), p.problem(), trial.getCandidate());
                if (out == null) {
                    throw new SolverException(p.id(), "solver returned null", null);
                }
            } catch (RuntimeException e) {
                SolverException se = (e instanceof SolverException s)
                        ? s
                        : new SolverException(p.id(), e.getMessage(), e);

                log.warn("❌ TRIAL #{} FAILED on problem {}: {}", trial.getNumber(), p.id(), se.getMessage(), se);
                trial.fail(se.getMessage(), clock.instant());
                return trial.getState();
            }

            boolean ok = out.answer() == p.answer();
            if (ok) correct++;
            totalElapsed += out.elapsedSec();

            double running = (double) correct / (idx + 1);
            trial.report(idx, running);

            if (log.isDebugEnabled()) {
                log.debug("TRIAL #{} problem={} expected={} predicted={} ok={} elapsed={}s acc={}",
                        trial.getNumber(), p.id(), p.answer(), out.answer(), ok, out.elapsedSec(), running);
            }

            PruneDecision d = pruner.check(study, trial.progress());
            if (d.prune()) {
                log.info("✂️ TRIAL #{} PRUNED at step {}: {}", trial.getNumber(), idx, d.reason());
                trial.prune(d.reason(), clock.instant());
                return trial.getState();
            }
        }

        EvaluationMetrics metrics = EvaluationMetrics.builder()
                .correct(correct)
                .problems(problems.size())
                .totalElapsedSec(totalElapsed)
                .build();

        double score = scorePolicy.score(metrics);
        trial.complete(score, clock.instant());

        log.info("✅ TRIAL #{} COMPLETE acc={} avgTime={}s score={}",
                trial.getNumber(), metrics.accuracy(), metrics.avgTimeSec(), score);

        return trial.getState();
    }
}
