package com.chicu.aimodelops.lifecycle.drift;

import lombok.experimental.UtilityClass;

/**
 * Population Stability Index между эталонным и текущим распределением.
 * Вход — доли (или счётчики) по одинаковым бинам; нормируем сами.
 * PSI = Σ (cur - ref) * ln(cur / ref); пустые бины сглаживаются EPSILON.
 */
@UtilityClass
public class PsiCalculator {

    static final double EPSILON = 1e-4;

    public static double psi(double[] reference, double[] current) {
        if (reference == null || current == null) {
            throw new IllegalArgumentException("distributions must not be null");
        }
        if (reference.length != current.length) {
            throw new IllegalArgumentException("bin count mismatch: " + reference.length + " vs " + current.length);
        }
        if (reference.length == 0) {
            throw new IllegalArgumentException("no bins");
        }

        double[] ref = normalize(reference);
        double[] cur = normalize(current);

        double psi = 0.0;
        for (int i = 0; i < ref.length; i++) {
            double r = Math.max(ref[i], EPSILON);
            double c = Math.max(cur[i], EPSILON);
            psi += (c - r) * Math.log(c / r);
        }
        return psi;
    }

    private static double[] normalize(double[] bins) {
        double total = 0.0;
        for (double b : bins) {
            if (b < 0 || Double.isNaN(b)) {
                throw new IllegalArgumentException("bin values must be >= 0");
            }
            total += b;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("distribution is empty");
        }
        double[] out = new double[bins.length];
        for (int i = 0; i < bins.length; i++) {
            out[i] = bins[i] / total;
        }
        return out;
    }
}
