package com.chicu.aimodelops.common.enums;

/**
 * Состояния автомата переобучения.
 * FAILED — терминальное для попытки, после него всегда IDLE.
 * HALTED — координатор остановлен из-за нарушения инварианта single-flight.
 */
public enum CoordinatorState {
    IDLE,
    FETCHING_DATA,
    TRAINING,
    VALIDATING,
    DEPLOYING,
    ROLLING_BACK,
    FAILED,
    HALTED
}
