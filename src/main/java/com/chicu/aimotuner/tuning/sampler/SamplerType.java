package com.chicu.aimotuner.tuning.sampler;

public enum SamplerType {
    TPE,
    RANDOM
}
