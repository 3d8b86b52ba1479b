package com.chicu.aimodelops.lifecycle.model;

import com.chicu.aimodelops.common.enums.ModelStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Одна обученная версия модели.
 * Неизменяемая: смена статуса = новый экземпляр (withStatus).
 */
@Builder
public record ModelVersion(
        String id,
        Instant createdAt,
        String artifactRef,
        Map<String, Double> metrics,
        ModelStatus status,
        String schemaVersion
) {

    public ModelVersion {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public ModelVersion withStatus(ModelStatus newStatus) {
        return new ModelVersion(id, createdAt, artifactRef, metrics, newStatus, schemaVersion);
    }

    public ModelVersion withArtifactRef(String newRef) {
        return new ModelVersion(id, createdAt, newRef, metrics, status, schemaVersion);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == ModelStatus.ACTIVE;
    }
}
