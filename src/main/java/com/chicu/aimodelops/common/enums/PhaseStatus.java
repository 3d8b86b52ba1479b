package com.chicu.aimodelops.common.enums;

public enum PhaseStatus {
    COMPLETED,
    TIMED_OUT,
    FAILED
}
