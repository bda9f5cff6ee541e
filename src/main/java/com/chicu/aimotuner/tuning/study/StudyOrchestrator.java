package com.chicu.aimotuner.tuning.study;

import com.chicu.aimotuner.tuning.TuningCandidate;
import com.chicu.aimotuner.tuning.TuningResult;
import com.chicu.aimotuner.tuning.eval.ObjectiveEvaluator;
import com.chicu.aimotuner.tuning.eval.ProblemSet;
import com.chicu.aimotuner.tuning.eval.Solver;
import com.chicu.aimotuner.tuning.sampler.ParameterSampler;
import com.chicu.aimotuner.tuning.sampler.ParameterSamplerFactory;
import com.chicu.aimotuner.tuning.space.InvalidParameterException;
import com.chicu.aimotuner.tuning.space.SearchSpace;
import com.chicu.aimotuner.tuning.store.ConfigStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Цикл trial'ов: строго последовательно, до maxTrials или timeout (что раньше),
 * либо до отмены. Таймаут проверяется между trial'ами и между задачами внутри trial'а,
 * так что перерасход ограничен одним вызовом солвера.
 */
@Slf4j
@RequiredArgsConstructor
public class StudyOrchestrator {

    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final String SAMPLING_FAILURE = "sampling: ";

    private final ParameterSamplerFactory samplerFactory;
    private final ObjectiveEvaluator evaluator;
    private final ConfigStore store;
    private final Clock clock;

    public TuningResult run(ProblemSet problems,
                            Solver solver,
                            SearchSpace space,
                            StudySettings settings) {
        return run(problems, solver, space, settings, new CancellationToken());
    }

    /**
     * Прогнать study, выбрать лучший trial, сохранить результат в ConfigStore.
     *
     * @throws EmptyStudyException если ни один trial не завершился COMPLETE
     */
    public TuningResult run(ProblemSet problems,
                            Solver solver,
                            SearchSpace space,
                            StudySettings settings,
                            CancellationToken cancellation) {

        Study study = execute(problems, solver, space, settings, cancellation);

        Trial best = study.bestTrial().orElse(null);
        if (best == null) {
            log.error("❌ STUDY {} EMPTY: trials={} pruned={} failed={} stop={}",
                    study.getName(), study.trialCount(),
                    study.count(TrialState.PRUNED), study.count(TrialState.FAILED), study.getStopReason());

            throw new EmptyStudyException(study.getName(), study.trialCount(),
                    study.count(TrialState.PRUNED), study.count(TrialState.FAILED), solverErrors(study));
        }

        TuningResult result = TuningResult.builder()
                .bestConfig(best.getCandidate().params())
                .bestScore(best.getScore())
                .trialCount(study.trialCount())
                .completeTrials(study.count(TrialState.COMPLETE))
                .prunedTrials(study.count(TrialState.PRUNED))
                .failedTrials(study.count(TrialState.FAILED))
                .solverErrors(solverErrors(study))
                .mode(settings.mode())
                .stopReason(study.getStopReason())
                .timestamp(LocalDateTime.now(clock).format(TIMESTAMP))
                .build();

        store.save(settings.storePath(), result);

        log.info("✅ STUDY {} DONE best=#{} score={} trials={} stop={} params={}",
                study.getName(), best.getNumber(), best.getScore(), study.trialCount(),
                study.getStopReason(), best.getCandidate().params());

        return result;
    }

    /**
     * Только цикл trial'ов, без выбора лучшего и сохранения.
     */
    public Study execute(ProblemSet problems,
                         Solver solver,
                         SearchSpace space,
                         StudySettings settings,
                         CancellationToken cancellation) {

        if (problems == null) throw new IllegalArgumentException("ProblemSet is null");
        if (solver == null) throw new IllegalArgumentException("Solver is null");
        if (space == null) throw new IllegalArgumentException("SearchSpace is null");
        if (settings == null) throw new IllegalArgumentException("StudySettings is null");
        if (cancellation == null) cancellation = new CancellationToken();

        Study study = new Study(settings.studyName());
        ParameterSampler sampler = samplerFactory.create(space, settings.seed());

        Instant started = clock.instant();
        Instant deadline = started.plus(settings.timeout());

        log.info("🧠 STUDY START {} mode={} maxTrials={} timeout={} seed={} problems={}",
                study.getName(), settings.mode(), settings.maxTrials(), settings.timeout(),
                settings.seed(), problems.size());

        StopReason stop = StopReason.MAX_TRIALS;

        while (study.trialCount() < settings.maxTrials()) {

            if (cancellation.isCancelled()) {
                stop = StopReason.INTERRUPTED;
                break;
            }
            if (!clock.instant().isBefore(deadline)) {
                stop = StopReason.TIMEOUT;
                break;
            }

            int number = study.trialCount();

            TuningCandidate candidate;
            try {
                candidate = sampler.propose(study, number);
            } catch (InvalidParameterException e) {
                // ломается только эта попытка сэмплинга, не study
                Trial t = study.newTrial(TuningCandidate.empty(), clock.instant());
                t.fail(SAMPLING_FAILURE + e.getMessage(), clock.instant());
                study.finish(t);
                log.warn("⚠️ TRIAL #{} sampling rejected: {}", number, e.getMessage());
                continue;
            }

            Trial trial = study.newTrial(candidate, clock.instant());
            log.info("🧠 TRIAL START #{} params={}", trial.getNumber(), candidate.params());

            TrialState state = evaluator.evaluate(study, trial, problems, solver, cancellation, deadline);
            study.finish(trial);

            if (state == TrialState.PRUNED && ObjectiveEvaluator.INTERRUPTED.equals(trial.getReason())) {
                stop = StopReason.INTERRUPTED;
                break;
            }
            if (state == TrialState.PRUNED && ObjectiveEvaluator.TIMEOUT.equals(trial.getReason())) {
                stop = StopReason.TIMEOUT;
                break;
            }
        }

        study.stop(stop);

        log.info("🧠 STUDY STOP {} reason={} trials={} complete={} pruned={} failed={} tookMs={}",
                study.getName(), stop, study.trialCount(),
                study.count(TrialState.COMPLETE), study.count(TrialState.PRUNED), study.count(TrialState.FAILED),
                Duration.between(started, clock.instant()).toMillis());

        return study;
    }

    private static List<String> solverErrors(Study study) {
        List<String> out = new ArrayList<>();
        for (Trial t : study.trials()) {
            if (t.getState() != TrialState.FAILED) continue;
            String why = (t.getReason() == null) ? "" : t.getReason();
            if (why.startsWith(SAMPLING_FAILURE)) continue;
            out.add("trial #" + t.getNumber() + ": " + why);
        }
        return out;
    }
}
