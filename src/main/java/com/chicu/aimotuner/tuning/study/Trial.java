package com.chicu.aimotuner.tuning.study;

import com.chicu.aimotuner.tuning.TuningCandidate;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Одна оценка одного кандидата. Меняется только владеющей оценкой,
 * после терминального состояния read-only.
 */
@Getter
public class Trial {

    private final int number;
    private final TuningCandidate candidate;
    private final Instant startedAt;

    private TrialState state = TrialState.RUNNING;
    private final List<IntermediateReport> reports = new ArrayList<>();

    private Double score;
    private String reason;
    private Instant finishedAt;

    Trial(int number, TuningCandidate candidate, Instant startedAt) {
        if (number < 0) throw new IllegalArgumentException("Trial number < 0: " + number);
        this.number = number;
        this.candidate = (candidate != null) ? candidate : TuningCandidate.empty();
        this.startedAt = startedAt;
    }

    public List<IntermediateReport> getReports() {
        return Collections.unmodifiableList(reports);
    }

    /**
     * Промежуточное значение на шаге step. Шаги строго возрастают.
     */
    public void report(int step, double value) {
        ensureRunning("report");
        if (step < 0) throw new IllegalArgumentException("step < 0: " + step);

        IntermediateReport last = reports.isEmpty() ? null : reports.get(reports.size() - 1);
        if (last != null && step <= last.step()) {
            throw new IllegalArgumentException("Trial #" + number + ": step " + step + " already reported (last=" + last.step() + ")");
        }
        reports.add(new IntermediateReport(step, value));
    }

    /**
     * Снимок для pruner'а: менять trial через него нельзя.
     */
    public TrialProgress progress() {
        return new TrialProgress(number, reports);
    }

    public OptionalDouble valueAt(int step) {
        for (IntermediateReport r : reports) {
            if (r.step() == step) return OptionalDouble.of(r.value());
        }
        return OptionalDouble.empty();
    }

    public void complete(double score, Instant at) {
        ensureRunning("complete");
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("Trial #" + number + ": score is NaN");
        }
        this.score = score;
        finish(TrialState.COMPLETE, null, at);
    }

    public void prune(String reason, Instant at) {
        ensureRunning("prune");
        finish(TrialState.PRUNED, reason, at);
    }

    public void fail(String error, Instant at) {
        ensureRunning("fail");
        finish(TrialState.FAILED, error, at);
    }

    public boolean isComplete() {
        return state == TrialState.COMPLETE;
    }

    private void finish(TrialState terminal, String why, Instant at) {
        this.state = terminal;
        this.reason = why;
        this.finishedAt = at;
    }

    private void ensureRunning(String op) {
        if (state != TrialState.RUNNING) {
            throw new IllegalStateException("Trial #" + number + " is " + state + ", cannot " + op);
        }
    }

    @Override
    public String toString() {
        return "Trial#" + number + "[" + state + (score != null ? ", score=" + score : "") + "]";
    }
}
