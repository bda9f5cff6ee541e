package com.chicu.aimotuner.tuning.study;

public enum TrialState {
    RUNNING,
    COMPLETE,
    PRUNED,
    FAILED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
