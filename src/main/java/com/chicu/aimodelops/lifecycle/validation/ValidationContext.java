package com.chicu.aimodelops.lifecycle.validation;

import com.chicu.aimodelops.lifecycle.model.Dataset;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Всё, что видят гейты. Метрики отчёта копятся здесь по мере прохождения гейтов.
 */
@Getter
public class ValidationContext {

    private final TrainedModel candidate;
    private final Map<String, Double> candidateMetrics;
    private final ModelVersion baseline;
    /** Метрики baseline на том же тестовом наборе (или сохранённые, если переоценить не вышло). */
    private final Map<String, Double> baselineMetrics;
    private final Dataset testSet;
    private final ValidationPolicy policy;
    private final Map<String, Double> reportMetrics = new LinkedHashMap<>();

    public ValidationContext(TrainedModel candidate,
                             Map<String, Double> candidateMetrics,
                             ModelVersion baseline,
                             Map<String, Double> baselineMetrics,
                             Dataset testSet,
                             ValidationPolicy policy) {
        this.candidate = candidate;
        this.candidateMetrics = candidateMetrics == null ? Map.of() : Map.copyOf(candidateMetrics);
        this.baseline = baseline;
        this.baselineMetrics = baselineMetrics == null ? Map.of() : Map.copyOf(baselineMetrics);
        this.testSet = testSet;
        this.policy = policy;
    }

    public Double candidateMetric(String name) {
        return candidateMetrics.get(name);
    }

    public Double baselineMetric(String name) {
        return baseline != null ? baselineMetrics.get(name) : null;
    }

    public void report(String key, double value) {
        reportMetrics.put(key, value);
    }
}
