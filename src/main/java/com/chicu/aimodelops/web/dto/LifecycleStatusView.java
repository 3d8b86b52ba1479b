package com.chicu.aimodelops.web.dto;

import com.chicu.aimodelops.common.enums.CoordinatorState;
import com.chicu.aimodelops.common.enums.RetrainOutcome;
import com.chicu.aimodelops.common.enums.RetrainReason;
import lombok.Builder;

@Builder
public record LifecycleStatusView(
        CoordinatorState state,
        boolean retraining,
        String currentAttemptId,
        String currentVersionId,
        RetrainOutcome lastOutcome,
        boolean halted,
        boolean requiresIntervention,
        int queueDepth,
        RetrainReason pendingNextReason,
        boolean coordinatorRunning,
        boolean supervisorRunning
) {}
