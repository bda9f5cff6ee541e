package com.chicu.aimotuner.tuning.study;

public enum StopReason {
    MAX_TRIALS,
    TIMEOUT,
    INTERRUPTED
}
