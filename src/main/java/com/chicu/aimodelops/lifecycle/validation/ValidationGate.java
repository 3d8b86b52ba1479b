package com.chicu.aimodelops.lifecycle.validation;

/**
 * Один шаг проверки кандидата. Гейты применяются по порядку {@link #order()},
 * первый отказ останавливает цепочку.
 */
public interface ValidationGate {

    String name();

    int order();

    /**
     * Код причины отказа для отчёта, например "improvement_gate_failed".
     */
    default String failureCode() {
        return name() + "_gate_failed";
    }

    GateDecision evaluate(ValidationContext ctx);
}
