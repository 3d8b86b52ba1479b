package com.chicu.aimodelops.lifecycle.monitor;

/**
 * Один замер наблюдателя: значение и пробит ли порог.
 */
public record Observation(double value, boolean breached, String detail) {

    public static Observation ok(double value) {
        return new Observation(value, false, null);
    }

    public static Observation breach(double value, String detail) {
        return new Observation(value, true, detail);
    }
}
