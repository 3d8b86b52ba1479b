package com.chicu.aimodelops.common.enums;

public enum RetrainOutcome {
    DEPLOYED,
    REJECTED,
    ABORTED,
    ERROR
}
