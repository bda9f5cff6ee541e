package com.chicu.aimotuner.tuning.study;

import lombok.Builder;

import java.nio.file.Path;
import java.time.Duration;

@Builder
public record StudySettings(
        String studyName,
        String mode,            // метка режима в результате (quick/full)
        int maxTrials,
        Duration timeout,
        long seed,
        Path storePath          // куда ConfigStore пишет результат
) {
    public StudySettings {
        if (maxTrials <= 0) {
            throw new IllegalArgumentException("StudySettings: maxTrials <= 0");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("StudySettings: timeout is null/negative");
        }
        if (storePath == null) {
            throw new IllegalArgumentException("StudySettings: storePath is null");
        }
    }
}
