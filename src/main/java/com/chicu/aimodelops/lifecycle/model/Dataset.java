package com.chicu.aimodelops.lifecycle.model;

/**
 * Ссылка на набор данных на стороне ML sidecar (сами строки в JVM не тянем).
 */
public record Dataset(
        String datasetId,
        String split,
        long rows
) {}
