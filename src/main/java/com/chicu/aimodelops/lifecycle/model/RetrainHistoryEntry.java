package com.chicu.aimodelops.lifecycle.model;

import com.chicu.aimodelops.common.enums.RetrainOutcome;
import lombok.Builder;

import java.time.Instant;

/**
 * Запись аудита одной попытки. После создания не меняется.
 */
@Builder
public record RetrainHistoryEntry(
        String attemptId,
        RetrainRequest request,
        Instant startedAt,
        Instant finishedAt,
        RetrainOutcome outcome,
        String candidateVersionId,
        String baselineVersionId,
        ValidatorReport validatorReport,
        String message
) {}
