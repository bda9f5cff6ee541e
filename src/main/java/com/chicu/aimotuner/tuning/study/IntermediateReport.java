package com.chicu.aimotuner.tuning.study;

public record IntermediateReport(
        int step,
        double value
) {}
