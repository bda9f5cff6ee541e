package com.chicu.aimotuner.tuning.smoke;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.TuningService;
import com.chicu.aimotuner.tuning.eval.JsonProblemSetLoader;
import com.chicu.aimotuner.tuning.eval.Solver;
import com.chicu.aimotuner.tuning.sampler.SamplerType;
import com.chicu.aimotuner.tuning.solver.ConstantAnswerSolver;
import com.chicu.aimotuner.tuning.store.ConfigStore;
import com.chicu.aimotuner.tuning.store.JsonFileConfigStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TuningContextSmokeTest {

    @Autowired
    TuningService tuningService;

    @Autowired
    TunerProperties props;

    @Autowired
    ConfigStore configStore;

    @Autowired
    Solver solver;

    @Autowired
    JsonProblemSetLoader problemLoader;

    @Test
    void contextShouldWireTuningBeans() {
        assertNotNull(tuningService);
        assertNotNull(problemLoader);
        assertInstanceOf(JsonFileConfigStore.class, configStore);
        assertInstanceOf(ConstantAnswerSolver.class, solver, "без реального солвера подключается заглушка");
    }

    @Test
    void propertiesShouldBindFromApplicationYml() {
        assertEquals(10, props.getQuickTrials());
        assertEquals(Duration.ofMinutes(30), props.getQuickTimeout());
        assertEquals(30, props.getFullTrials());
        assertEquals(Duration.ofHours(1), props.getFullTimeout());

        assertEquals(4, props.getSpace().getKMin());
        assertEquals(512, props.getSpace().getMaxTokensStep());
        assertEquals(2, props.getSpace().getPromptStyles().size());

        assertEquals(SamplerType.TPE, props.getSampler().getType());
        assertEquals(3, props.getPruner().getStartupTrials());
        assertEquals(180.0, props.getScore().getTimeBudgetPerProblem(), 1e-12);
        assertFalse(props.getRunner().isEnabled());
        assertTrue(props.getPresets().containsKey("conservative"));
    }
}
