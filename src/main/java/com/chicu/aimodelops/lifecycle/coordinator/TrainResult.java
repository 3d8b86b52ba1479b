package com.chicu.aimodelops.lifecycle.coordinator;

import com.chicu.aimodelops.common.enums.PhaseStatus;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;

import java.time.Duration;

public record TrainResult(
        PhaseStatus status,
        TrainedModel model,
        Duration elapsed,
        String error
) {
    public static TrainResult completed(TrainedModel model, Duration elapsed) {
        return new TrainResult(PhaseStatus.COMPLETED, model, elapsed, null);
    }

    public static TrainResult timedOut(Duration elapsed, String error) {
        return new TrainResult(PhaseStatus.TIMED_OUT, null, elapsed, error);
    }

    public static TrainResult failed(Duration elapsed, String error) {
        return new TrainResult(PhaseStatus.FAILED, null, elapsed, error);
    }
}
