package com.chicu.aimotuner.tuning.study;

import com.chicu.aimotuner.tuning.TuningCandidate;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Все trial'ы одного запуска тюнинга (направление maximize).
 * Только добавление: trial'ы и промежуточные значения никогда не удаляются.
 */
public class Study {

    @Getter
    private final String name;

    private final List<Trial> trials = new ArrayList<>();

    @Getter
    private StopReason stopReason;

    /**
     * step -> значения COMPLETE trial'ов на этом шаге (история для pruner'а).
     */
    private final Map<Integer, List<Double>> completedValuesByStep = new TreeMap<>();

    private final Set<Integer> finished = new HashSet<>();

    public Study(String name) {
        this.name = (name == null || name.isBlank()) ? "study" : name.trim();
    }

    public Trial newTrial(TuningCandidate candidate, Instant startedAt) {
        Trial running = runningTrial().orElse(null);
        if (running != null) {
            throw new IllegalStateException("Study " + name + ": trial #" + running.getNumber() + " is still running");
        }
        Trial t = new Trial(trials.size(), candidate, startedAt);
        trials.add(t);
        return t;
    }

    /**
     * Зафиксировать терминальное состояние trial'а в истории study.
     */
    public void finish(Trial trial) {
        if (trial == null || trial.getNumber() >= trials.size() || trials.get(trial.getNumber()) != trial) {
            throw new IllegalArgumentException("Study " + name + ": trial does not belong to this study");
        }
        if (!trial.getState().isFinished()) {
            throw new IllegalStateException("Study " + name + ": trial #" + trial.getNumber() + " is still running");
        }
        if (!finished.add(trial.getNumber())) {
            throw new IllegalStateException("Study " + name + ": trial #" + trial.getNumber() + " already finished");
        }
        if (trial.isComplete()) {
            for (IntermediateReport r : trial.getReports()) {
                completedValuesByStep.computeIfAbsent(r.step(), s -> new ArrayList<>()).add(r.value());
            }
        }
    }

    /**
     * Почему остановился цикл; выставляется один раз.
     */
    public void stop(StopReason reason) {
        if (reason == null) throw new IllegalArgumentException("Study " + name + ": stop reason is null");
        if (stopReason != null) {
            throw new IllegalStateException("Study " + name + " already stopped: " + stopReason);
        }
        this.stopReason = reason;
    }

    public List<Trial> trials() {
        return Collections.unmodifiableList(trials);
    }

    public int trialCount() {
        return trials.size();
    }

    public List<Trial> completedTrials() {
        List<Trial> out = new ArrayList<>();
        for (Trial t : trials) {
            if (t.isComplete()) out.add(t);
        }
        return out;
    }

    public int count(TrialState state) {
        int n = 0;
        for (Trial t : trials) {
            if (t.getState() == state) n++;
        }
        return n;
    }

    public List<Double> completedValuesAt(int step) {
        List<Double> v = completedValuesByStep.get(step);
        return (v == null) ? List.of() : Collections.unmodifiableList(v);
    }

    /**
     * Лучший COMPLETE trial: максимальный score, при равенстве меньший номер.
     */
    public Optional<Trial> bestTrial() {
        Trial best = null;
        for (Trial t : trials) {
            if (!t.isComplete()) continue;
            if (best == null || t.getScore() > best.getScore()) {
                best = t;
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<Trial> runningTrial() {
        for (Trial t : trials) {
            if (t.getState() == TrialState.RUNNING) return Optional.of(t);
        }
        return Optional.empty();
    }
}
