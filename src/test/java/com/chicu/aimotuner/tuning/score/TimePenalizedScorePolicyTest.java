package com.chicu.aimotuner.tuning.score;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.eval.EvaluationMetrics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimePenalizedScorePolicyTest {

    private final TimePenalizedScorePolicy linear = new TimePenalizedScorePolicy(180.0, 0.1);

    @Test
    void score_overBudget_shouldSubtractLinearPenalty() {
        // avg = 200s, превышение (200-180)/180 = 0.1111
        EvaluationMetrics m = metrics(8, 10, 2000.0);

        assertEquals(0.8, m.accuracy(), 1e-12);
        assertEquals(200.0, m.avgTimeSec(), 1e-12);
        assertEquals(0.788889, linear.score(m), 1e-6);
    }

    @Test
    void score_underBudget_shouldEqualAccuracy() {
        assertEquals(1.0, linear.score(metrics(3, 3, 30.0)), 1e-12);
        assertEquals(0.0, linear.timePenalty(180.0), 1e-12, "ровно на бюджете штрафа нет");
    }

    @Test
    void score_shouldBeBoundedByAccuracyFromAbove() {
        for (double total : new double[]{0, 100, 1800, 5000, 100_000}) {
            EvaluationMetrics m = metrics(5, 10, total);
            assertTrue(linear.score(m) <= m.accuracy());
        }
    }

    @Test
    void linearPenalty_isUncappedByDefault() {
        // avg = 1800s -> превышение 9.0 -> score = 1 - 0.9
        assertEquals(0.1, linear.score(metrics(1, 1, 1800.0)), 1e-9);
        assertEquals(19.0, linear.timePenalty(3600.0), 1e-9);
    }

    @Test
    void cap_shouldLimitPenalty() {
        TimePenalizedScorePolicy capped = new TimePenalizedScorePolicy(180.0, 0.1, 1.0, 2.0);

        assertEquals(2.0, capped.timePenalty(3600.0), 1e-12);
        assertEquals(0.8, capped.score(metrics(1, 1, 3600.0)), 1e-9);
        assertEquals(0.5, capped.timePenalty(270.0), 1e-12, "ниже потолка не меняется");
    }

    @Test
    void exponent_shouldShapePenalty() {
        TimePenalizedScorePolicy quadratic = new TimePenalizedScorePolicy(100.0, 1.0, 2.0, null);

        assertEquals(0.25, quadratic.timePenalty(150.0), 1e-12);
        assertEquals(4.0, quadratic.timePenalty(300.0), 1e-12);
    }

    @Test
    void fromProperties_shouldUseDefaults() {
        TimePenalizedScorePolicy p = TimePenalizedScorePolicy.fromProperties(new TunerProperties.Score());

        assertEquals(180.0, p.getTimeBudgetPerProblem(), 1e-12);
        assertEquals(0.1, p.getTimePenaltyWeight(), 1e-12);
        assertEquals(1.0, p.getPenaltyExponent(), 1e-12);
        assertNull(p.getPenaltyCap());
    }

    @Test
    void constructor_shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new TimePenalizedScorePolicy(0.0, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new TimePenalizedScorePolicy(180.0, -0.1));
        assertThrows(IllegalArgumentException.class, () -> new TimePenalizedScorePolicy(180.0, 0.1, 0.0, null));
        assertThrows(IllegalArgumentException.class, () -> new TimePenalizedScorePolicy(180.0, 0.1, 1.0, -1.0));
    }

    @Test
    void metrics_shouldValidateCounts() {
        assertThrows(IllegalArgumentException.class, () -> metrics(0, 0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> metrics(4, 3, 0.0));
    }

    private static EvaluationMetrics metrics(int correct, int problems, double totalSec) {
        return EvaluationMetrics.builder()
                .correct(correct)
                .problems(problems)
                .totalElapsedSec(totalSec)
                .build();
    }
}
