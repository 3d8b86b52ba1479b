package com.chicu.aimodelops.lifecycle.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Итог валидации кандидата. Прикладывается к записи аудита при любом исходе.
 *
 * @param failedGate имя первого не пройденного гейта, null если принят
 * @param reasons    человекочитаемые причины вида "improvement_gate_failed: ..."
 * @param metrics    все посчитанные метрики (candidate.*, baseline.*, delta.*, stability.*)
 */
@Builder
public record ValidatorReport(
        boolean accepted,
        String failedGate,
        List<String> reasons,
        Map<String, Double> metrics
) {

    public ValidatorReport {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
