package com.chicu.aimotuner.tuning.study;

import java.util.List;
import java.util.Optional;

/**
 * Read-only снимок running-trial'а для pruner'а: номер и промежуточные отчёты.
 */
public record TrialProgress(
        int number,
        List<IntermediateReport> reports
) {
    public TrialProgress {
        reports = (reports == null) ? List.of() : List.copyOf(reports);
    }

    public Optional<IntermediateReport> lastReport() {
        return reports.isEmpty() ? Optional.empty() : Optional.of(reports.get(reports.size() - 1));
    }
}
