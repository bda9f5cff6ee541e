package com.chicu.aimotuner.tuning.sampler;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.space.SearchSpace;

@FunctionalInterface
public interface ParameterSamplerFactory {

    ParameterSampler create(SearchSpace space, long seed);

    static ParameterSamplerFactory fromProperties(TunerProperties.Sampler props) {
        if (props == null || props.getType() == null) {
            throw new IllegalArgumentException("Sampler properties/type is null");
        }
        return switch (props.getType()) {
            case RANDOM -> RandomParameterSampler::new;
            case TPE -> (space, seed) -> new TpeParameterSampler(
                    space,
                    seed,
                    props.getStartupTrials(),
                    props.getGamma(),
                    props.getCandidates(),
                    props.getPriorWeight()
            );
        };
    }
}
