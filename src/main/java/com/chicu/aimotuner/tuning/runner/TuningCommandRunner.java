package com.chicu.aimotuner.tuning.runner;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.TuningMode;
import com.chicu.aimotuner.tuning.TuningResult;
import com.chicu.aimotuner.tuning.TuningService;
import com.chicu.aimotuner.tuning.eval.JsonProblemSetLoader;
import com.chicu.aimotuner.tuning.eval.ProblemSet;
import com.chicu.aimotuner.tuning.eval.Solver;
import com.chicu.aimotuner.tuning.study.EmptyStudyException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Запуск тюнинга при старте приложения (aimo.tuning.runner.enabled=true).
 * Режим можно передать аргументом: --mode=full.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TuningCommandRunner implements ApplicationRunner {

    static final String MODE_OPTION = "mode";

    private final TunerProperties props;
    private final TuningService tuningService;
    private final JsonProblemSetLoader problemLoader;
    private final Solver solver;

    @Override
    public void run(ApplicationArguments args) {
        TunerProperties.Runner r = props.getRunner();
        if (r == null || !r.isEnabled()) {
            log.debug("Tuning runner disabled");
            return;
        }

        TuningMode mode = resolveMode(args, r.getMode());
        ProblemSet problems = problemLoader.load(Path.of(r.getProblemsPath()));
        long seed = (r.getSeed() != null) ? r.getSeed() : props.getDefaultSeed();

        try {
            TuningResult res = tuningService.runTuning(problems, solver, mode, props, seed);

            log.info("🏁 Best config (score={}):", String.format("%.4f", res.bestScore()));
            for (Map.Entry<String, Object> e : res.bestConfig().entrySet()) {
                log.info("   {}: {}", e.getKey(), e.getValue());
            }
        } catch (EmptyStudyException e) {
            // приложение не валим: лучшего просто нет
            log.error("❌ Tuning produced no completed trials: {}", e.getMessage());
            for (String err : e.getSolverErrors()) {
                log.error("   {}", err);
            }
        }
    }

    /**
     * --mode=quick|full в аргументах запуска перекрывает aimo.tuning.runner.mode.
     */
    static TuningMode resolveMode(ApplicationArguments args, TuningMode configured) {
        List<String> cli = (args == null) ? null : args.getOptionValues(MODE_OPTION);
        if (cli == null || cli.isEmpty()) {
            return configured;
        }
        return TuningMode.fromLabel(cli.get(cli.size() - 1));
    }
}
