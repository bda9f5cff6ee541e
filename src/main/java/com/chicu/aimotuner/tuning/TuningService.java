package com.chicu.aimotuner.tuning;

import com.chicu.aimotuner.tuning.eval.ObjectiveEvaluator;
import com.chicu.aimotuner.tuning.eval.ProblemSet;
import com.chicu.aimotuner.tuning.eval.Solver;
import com.chicu.aimotuner.tuning.pruner.TrialPruner;
import com.chicu.aimotuner.tuning.sampler.ParameterSamplerFactory;
import com.chicu.aimotuner.tuning.score.TimePenalizedScorePolicy;
import com.chicu.aimotuner.tuning.space.SearchSpace;
import com.chicu.aimotuner.tuning.store.ConfigStore;
import com.chicu.aimotuner.tuning.study.CancellationToken;
import com.chicu.aimotuner.tuning.study.StudyOrchestrator;
import com.chicu.aimotuner.tuning.study.StudySettings;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Точка входа тюнинга: режимы quick/full, сборка study из конфигурации, загрузка лучшего конфига.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TuningService {

    private final TunerProperties props;
    private final ConfigStore configStore;
    private final Clock clock;

    /**
     * ✅ Защита от дублей: на один путь сохранения только один тюнинг одновременно.
     */
    private final Set<Path> inFlight = ConcurrentHashMap.newKeySet();

    private final Map<Path, CancellationToken> running = new ConcurrentHashMap<>();

    public TuningResult runTuning(ProblemSet problems, Solver solver, TuningMode mode) {
        return runTuning(problems, solver, mode, props, props.getDefaultSeed());
    }

    public TuningResult runTuning(ProblemSet problems,
                                  Solver solver,
                                  TuningMode mode,
                                  TunerProperties config,
                                  long seed) {

        if (problems == null) throw new IllegalArgumentException("ProblemSet is null");
        if (solver == null) throw new IllegalArgumentException("Solver is null");

        TuningMode m = (mode != null) ? mode : TuningMode.QUICK;
        TunerProperties cfg = (config != null) ? config : props;

        int maxTrials = (m == TuningMode.QUICK) ? cfg.getQuickTrials() : cfg.getFullTrials();
        Duration timeout = (m == TuningMode.QUICK) ? cfg.getQuickTimeout() : cfg.getFullTimeout();

        Path storePath = Path.of(cfg.getConfigSavePath()).toAbsolutePath().normalize();

        if (!inFlight.add(storePath)) {
            throw new IllegalStateException("Тюнинг уже выполняется для " + storePath);
        }

        CancellationToken token = new CancellationToken();
        running.put(storePath, token);

        long started = System.currentTimeMillis();
        try {
            SearchSpace space = SearchSpace.fromProperties(cfg.getSpace());

            ObjectiveEvaluator evaluator = new ObjectiveEvaluator(
                    TrialPruner.fromProperties(cfg.getPruner()),
                    TimePenalizedScorePolicy.fromProperties(cfg.getScore()),
                    clock
            );

            StudyOrchestrator orchestrator = new StudyOrchestrator(
                    ParameterSamplerFactory.fromProperties(cfg.getSampler()),
                    evaluator,
                    configStore,
                    clock
            );

            StudySettings settings = StudySettings.builder()
                    .studyName("aimo3_tuning_" + m.label())
                    .mode(m.label())
                    .maxTrials(maxTrials)
                    .timeout(timeout)
                    .seed(seed)
                    .storePath(storePath)
                    .build();

            log.info("🧠 TUNE START mode={} trials={} timeout={} seed={} sampler={} pruner={} store={}",
                    m.label(), maxTrials, timeout, seed,
                    cfg.getSampler().getType(), cfg.getPruner().isEnabled() ? "median" : "none", storePath);

            TuningResult res = orchestrator.run(problems, solver, space, settings, token);

            log.info("✅ TUNE DONE mode={} score={} trials={} failed={} tookMs={}",
                    m.label(), res.bestScore(), res.trialCount(), res.failedTrials(),
                    System.currentTimeMillis() - started);

            return res;

        } finally {
            running.remove(storePath);
            inFlight.remove(storePath);
        }
    }

    /**
     * Операторская отмена всех идущих тюнингов: текущий trial обрезается, завершённые остаются.
     */
    public void cancelAll() {
        if (!running.isEmpty()) {
            log.warn("⛔ Cancelling {} running tuning(s)", running.size());
        }
        running.values().forEach(CancellationToken::cancel);
    }

    public Map<String, Object> loadBestConfig() {
        return loadBestConfig(Path.of(props.getConfigSavePath()));
    }

    public Map<String, Object> loadBestConfig(Path path) {
        return configStore.loadBestConfig(path);
    }

    /**
     * Сохранённый лучший конфиг, а если его ещё нет, именованный пресет.
     */
    public Map<String, Object> loadBestConfigOrPreset(Path path, String presetName) {
        Map<String, Object> saved = loadBestConfig(path);
        if (!saved.isEmpty()) {
            return saved;
        }

        Map<String, Object> preset = props.getPresets().get(presetName);
        if (preset == null) {
            throw new IllegalArgumentException("Unknown preset: " + presetName + " (known: " + props.getPresets().keySet() + ")");
        }
        log.info("No saved tuning result at {}, using preset '{}'", path, presetName);
        return new LinkedHashMap<>(preset);
    }

    public Map<String, Map<String, Object>> presets() {
        return new LinkedHashMap<>(props.getPresets());
    }

    @PreDestroy
    void shutdown() {
        cancelAll();
    }
}
