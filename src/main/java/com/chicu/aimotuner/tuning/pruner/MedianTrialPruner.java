package com.chicu.aimotuner.tuning.pruner;

import com.chicu.aimotuner.tuning.study.IntermediateReport;
import com.chicu.aimotuner.tuning.study.Study;
import com.chicu.aimotuner.tuning.study.TrialProgress;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Обрезаем trial, если его значение на шаге s строго ниже медианы
 * COMPLETE trial'ов на том же шаге.
 * <ul>
 *     <li>warmup: шаги s &lt; warmupSteps не проверяются;</li>
 *     <li>startup: на шаге s должно быть не меньше startupTrials COMPLETE значений.</li>
 * </ul>
 */
@Getter
public class MedianTrialPruner implements TrialPruner {

    private final int startupTrials;
    private final int warmupSteps;

    public MedianTrialPruner(int startupTrials, int warmupSteps) {
        if (startupTrials < 0) throw new IllegalArgumentException("MedianTrialPruner: startupTrials < 0");
        if (warmupSteps < 0) throw new IllegalArgumentException("MedianTrialPruner: warmupSteps < 0");
        this.startupTrials = startupTrials;
        this.warmupSteps = warmupSteps;
    }

    @Override
    public PruneDecision check(Study study, TrialProgress trial) {
        Optional<IntermediateReport> last = trial.lastReport();
        if (last.isEmpty()) {
            return PruneDecision.keep("no reports yet");
        }

        int step = last.get().step();
        double value = last.get().value();

        if (step < warmupSteps) {
            return PruneDecision.keep("warmup: step " + step + " < " + warmupSteps);
        }

        List<Double> history = study.completedValuesAt(step);
        if (history.size() < startupTrials) {
            return PruneDecision.keep("startup: " + history.size() + " completed trials at step " + step);
        }
        if (history.isEmpty()) {
            return PruneDecision.keep("no history at step " + step);
        }

        if (Double.isNaN(value)) {
            return PruneDecision.prune("value is NaN at step " + step);
        }

        double median = median(history);
        if (value < median) {
            return PruneDecision.prune(String.format(Locale.ROOT, "step %d: %.4f < median %.4f", step, value, median));
        }
        return PruneDecision.keep(String.format(Locale.ROOT, "step %d: %.4f >= median %.4f", step, value, median));
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        if (n % 2 == 1) return sorted.get(n / 2);
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }
}
