package com.chicu.aimodelops.common.enums;

public enum WatcherType {
    PERFORMANCE,
    DRIFT,
    SCHEDULE,
    RESOURCE,
    PROBATION
}
