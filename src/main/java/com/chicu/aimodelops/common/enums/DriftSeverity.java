package com.chicu.aimodelops.common.enums;

public enum DriftSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * MEDIUM — выше порога, HIGH — выше 1.5x, CRITICAL — выше 2x.
     */
    public static DriftSeverity of(double score, double threshold) {
        if (score > threshold * 2) return CRITICAL;
        if (score > threshold * 1.5) return HIGH;
        if (score > threshold) return MEDIUM;
        return LOW;
    }
}
