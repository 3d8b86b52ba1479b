package com.chicu.aimodelops.runtime;

import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.lifecycle.coordinator.RetrainCoordinator;
import com.chicu.aimodelops.lifecycle.history.RetrainHistoryService;
import com.chicu.aimodelops.lifecycle.model.LifecycleStatus;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.RetrainHistoryEntry;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.WatcherState;
import com.chicu.aimodelops.lifecycle.monitor.MonitorSupervisor;
import com.chicu.aimodelops.lifecycle.monitor.RetrainRequestQueue;
import com.chicu.aimodelops.lifecycle.version.VersionManager;
import com.chicu.aimodelops.web.dto.LifecycleStatusView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Точка входа для REST: собирает статус и принимает операторские команды.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LifecycleFacade {

    private final LifecycleStatus status;
    private final VersionManager versionManager;
    private final RetrainCoordinator coordinator;
    private final MonitorSupervisor supervisor;
    private final RetrainRequestQueue queue;
    private final RetrainHistoryService history;
    private final Clock clock;

    public LifecycleStatusView status() {
        RetrainRequest pending = coordinator.getPendingNext();
        return LifecycleStatusView.builder()
                .state(status.getState())
                .retraining(status.isRetraining())
                .currentAttemptId(status.getCurrentAttemptId())
                .currentVersionId(status.getCurrentVersionId())
                .lastOutcome(status.getLastOutcome())
                .halted(status.isHalted())
                .requiresIntervention(status.isRequiresIntervention())
                .queueDepth(queue.size())
                .pendingNextReason(pending != null ? pending.reason() : null)
                .coordinatorRunning(coordinator.isRunning())
                .supervisorRunning(supervisor.isRunning())
                .build();
    }

    public List<ModelVersion> versions() {
        return versionManager.versions();
    }

    public Optional<ModelVersion> currentVersion() {
        return versionManager.current();
    }

    public List<RetrainHistoryEntry> history(int limit) {
        return history.recent(limit);
    }

    public Optional<RetrainHistoryEntry> attempt(String attemptId) {
        return history.find(attemptId);
    }

    public Map<String, WatcherState> watchers() {
        return supervisor.states();
    }

    /**
     * @return false — ручная заявка уже в очереди или в работе
     */
    public boolean requestRetrain(String detail) {
        RetrainRequest request = RetrainRequest.of(RetrainReason.MANUAL, clock.instant(),
                detail != null && !detail.isBlank() ? detail : "operator request");
        boolean queued = supervisor.submit(request);
        log.info("🌐 [API] manual retrain requested queued={} detail={}", queued, request.detail());
        return queued;
    }

    public ModelVersion rollback(String target) {
        log.info("🌐 [API] rollback requested target={}", target != null ? target : "previous");
        return coordinator.rollback(target);
    }
}
