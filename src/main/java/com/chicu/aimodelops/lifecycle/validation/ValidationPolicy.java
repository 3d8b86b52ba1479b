package com.chicu.aimodelops.lifecycle.validation;

import com.chicu.aimodelops.config.LifecycleProperties;
import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Снимок настроек валидации на время одной попытки.
 */
@Builder
public record ValidationPolicy(
        List<String> trackedMetrics,
        double improvementThreshold,
        Map<String, Double> minimumRequirements,
        double stabilityThreshold,
        int stabilityRuns,
        String expectedSchemaVersion,
        Set<String> lowerIsBetter
) {

    public ValidationPolicy {
        trackedMetrics = trackedMetrics == null ? List.of() : List.copyOf(trackedMetrics);
        minimumRequirements = minimumRequirements == null ? Map.of() : Map.copyOf(minimumRequirements);
        lowerIsBetter = lowerIsBetter == null ? Set.of() : Set.copyOf(lowerIsBetter);
    }

    public static ValidationPolicy from(LifecycleProperties.Validation v) {
        return ValidationPolicy.builder()
                .trackedMetrics(v.getTrackedMetrics())
                .improvementThreshold(v.getImprovementThreshold())
                .minimumRequirements(v.getMinimumRequirements())
                .stabilityThreshold(v.getStabilityThreshold())
                .stabilityRuns(v.getStabilityRuns())
                .expectedSchemaVersion(v.getExpectedSchemaVersion())
                .lowerIsBetter(v.getLowerIsBetter())
                .build();
    }

    public boolean isLowerBetter(String metric) {
        return lowerIsBetter.contains(metric);
    }
}
