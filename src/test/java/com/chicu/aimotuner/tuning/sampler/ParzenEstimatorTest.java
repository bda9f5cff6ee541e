package com.chicu.aimotuner.tuning.sampler;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ParzenEstimatorTest {

    @Test
    void normalCdf_shouldMatchKnownQuantiles() {
        assertEquals(0.5, ParzenEstimator.normalCdf(0.0), 1e-7);
        assertEquals(0.975, ParzenEstimator.normalCdf(1.959964), 1e-6);
        assertEquals(0.025, ParzenEstimator.normalCdf(-1.959964), 1e-6);
    }

    @Test
    void density_shouldIntegrateToOneOverDomain() {
        ParzenEstimator pe = new ParzenEstimator(new double[]{0.1, 0.15, 0.9}, 0.0, 1.0, 1.0);

        int n = 20_000;
        double h = 1.0 / n;
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += Math.exp(pe.logPdf((i + 0.5) * h)) * h;
        }
        assertEquals(1.0, sum, 0.01);
    }

    @Test
    void density_shouldPeakNearObservations() {
        ParzenEstimator pe = new ParzenEstimator(new double[]{0.2, 0.21, 0.22}, 0.0, 1.0, 1.0);

        assertTrue(pe.logPdf(0.21) > pe.logPdf(0.8));
        assertEquals(Double.NEGATIVE_INFINITY, pe.logPdf(1.5));
    }

    @Test
    void sample_shouldStayInsideBounds() {
        ParzenEstimator pe = new ParzenEstimator(new double[]{0.0, 1.0}, 0.0, 1.0, 1.0);
        Random rnd = new Random(3);
        for (int i = 0; i < 2000; i++) {
            double x = pe.sample(rnd);
            assertTrue(x >= 0.0 && x <= 1.0, "x=" + x);
        }
    }

    @Test
    void priorOnly_shouldStillBeAValidDensity() {
        ParzenEstimator pe = new ParzenEstimator(new double[0], -5.0, 5.0, 1.0);
        assertTrue(Double.isFinite(pe.logPdf(-5.0)));
        assertTrue(Double.isFinite(pe.logPdf(5.0)));
    }
}
