package com.chicu.aimodelops.lifecycle.coordinator;

import com.chicu.aimodelops.common.enums.PhaseStatus;
import com.chicu.aimodelops.lifecycle.model.TrainingData;

public record FetchResult(
        PhaseStatus status,
        TrainingData data,
        String error
) {
    public static FetchResult completed(TrainingData data) {
        return new FetchResult(PhaseStatus.COMPLETED, data, null);
    }

    public static FetchResult timedOut(String error) {
        return new FetchResult(PhaseStatus.TIMED_OUT, null, error);
    }

    public static FetchResult failed(String error) {
        return new FetchResult(PhaseStatus.FAILED, null, error);
    }

    public boolean isCompleted() {
        return status == PhaseStatus.COMPLETED;
    }
}
