package com.chicu.aimodelops.common.enums;

/**
 * Причина запроса на переобучение.
 * Приоритет: MANUAL > PERFORMANCE_DEGRADATION > DATA_DRIFT > SCHEDULED.
 */
public enum RetrainReason {

    MANUAL(400, "manual"),
    PERFORMANCE_DEGRADATION(300, "performance_degradation"),
    DATA_DRIFT(200, "data_drift"),
    SCHEDULED(100, "scheduled");

    private final int priority;
    private final String code;

    RetrainReason(int priority, String code) {
        this.priority = priority;
        this.code = code;
    }

    public int priority() {
        return priority;
    }

    public String code() {
        return code;
    }
}
