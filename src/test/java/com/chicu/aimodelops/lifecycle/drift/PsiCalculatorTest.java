package com.chicu.aimodelops.lifecycle.drift;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PsiCalculatorTest {

    @Test
    void identicalDistributions_zero() {
        double[] d = {0.1, 0.2, 0.3, 0.4};
        assertEquals(0.0, PsiCalculator.psi(d, d), 1e-12);
    }

    @Test
    void countsAreNormalized() {
        double[] shares = {0.25, 0.25, 0.5};
        double[] counts = {25, 25, 50};
        assertEquals(0.0, PsiCalculator.psi(shares, counts), 1e-12);
    }

    @Test
    void knownValue() {
        double[] ref = {0.5, 0.5};
        double[] cur = {0.8, 0.2};
        double expected = (0.8 - 0.5) * Math.log(0.8 / 0.5) + (0.2 - 0.5) * Math.log(0.2 / 0.5);

        assertEquals(expected, PsiCalculator.psi(ref, cur), 1e-12);
    }

    @Test
    void emptyBin_isSmoothedNotInfinite() {
        double psi = PsiCalculator.psi(new double[]{0.5, 0.5}, new double[]{1.0, 0.0});

        assertTrue(Double.isFinite(psi));
        assertTrue(psi > 0.2);
    }

    @Test
    void invalidInput_rejected() {
        assertThrows(IllegalArgumentException.class, () -> PsiCalculator.psi(new double[]{1}, new double[]{0.5, 0.5}));
        assertThrows(IllegalArgumentException.class, () -> PsiCalculator.psi(new double[]{0, 0}, new double[]{1, 1}));
        assertThrows(IllegalArgumentException.class, () -> PsiCalculator.psi(new double[]{-1, 2}, new double[]{1, 1}));
        assertThrows(IllegalArgumentException.class, () -> PsiCalculator.psi(new double[0], new double[0]));
    }
}
