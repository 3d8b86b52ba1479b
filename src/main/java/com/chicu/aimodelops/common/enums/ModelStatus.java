package com.chicu.aimodelops.common.enums;

public enum ModelStatus {
    CANDIDATE,
    ACTIVE,
    RETIRED,
    FAILED
}
