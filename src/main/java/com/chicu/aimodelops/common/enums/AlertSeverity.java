package com.chicu.aimodelops.common.enums;

public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
