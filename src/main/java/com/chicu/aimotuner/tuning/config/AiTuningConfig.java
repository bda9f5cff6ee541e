package com.chicu.aimotuner.tuning.config;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.eval.Solver;
import com.chicu.aimotuner.tuning.solver.ConstantAnswerSolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TunerProperties.class)
public class AiTuningConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock tuningClock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Заглушка солвера, пока реальный не подключён отдельным bean'ом.
     */
    @Bean
    @ConditionalOnMissingBean(Solver.class)
    public Solver constantAnswerSolver() {
        return new ConstantAnswerSolver(0L);
    }
}
