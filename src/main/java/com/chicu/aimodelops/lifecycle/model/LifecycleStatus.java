package com.chicu.aimodelops.lifecycle.model;

import com.chicu.aimodelops.common.enums.CoordinatorState;
import com.chicu.aimodelops.common.enums.RetrainOutcome;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Общий статус, который видят наблюдатели, API и health.
 * Пишут только координатор (retraining/state/attempt) и менеджер версий (currentVersionId).
 */
@Component
public class LifecycleStatus {

    private final AtomicBoolean retraining = new AtomicBoolean(false);
    private final AtomicReference<CoordinatorState> state = new AtomicReference<>(CoordinatorState.IDLE);
    private final AtomicReference<String> currentAttemptId = new AtomicReference<>();
    private final AtomicReference<String> currentVersionId = new AtomicReference<>();
    private final AtomicReference<RetrainOutcome> lastOutcome = new AtomicReference<>();
    private volatile boolean requiresIntervention;

    /**
     * Вход в single-flight. false — кто-то уже переобучает.
     */
    public boolean tryBeginRetrain(String attemptId) {
        if (!retraining.compareAndSet(false, true)) {
            return false;
        }
        currentAttemptId.set(attemptId);
        return true;
    }

    public void endRetrain(RetrainOutcome outcome) {
        if (outcome != null) {
            lastOutcome.set(outcome);
        }
        currentAttemptId.set(null);
        retraining.set(false);
    }

    public boolean isRetraining() {
        return retraining.get();
    }

    public CoordinatorState getState() {
        return state.get();
    }

    public void setState(CoordinatorState newState) {
        state.set(newState);
    }

    public String getCurrentAttemptId() {
        return currentAttemptId.get();
    }

    public String getCurrentVersionId() {
        return currentVersionId.get();
    }

    public void setCurrentVersionId(String versionId) {
        currentVersionId.set(versionId);
    }

    public RetrainOutcome getLastOutcome() {
        return lastOutcome.get();
    }

    public boolean isHalted() {
        return state.get() == CoordinatorState.HALTED;
    }

    public boolean isRequiresIntervention() {
        return requiresIntervention;
    }

    public void setRequiresIntervention(boolean value) {
        this.requiresIntervention = value;
    }
}
