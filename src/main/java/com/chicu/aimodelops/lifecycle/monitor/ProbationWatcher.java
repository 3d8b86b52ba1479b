package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.ModelStatus;
import com.chicu.aimodelops.common.enums.WatcherType;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.coordinator.RetrainCoordinator;
import com.chicu.aimodelops.lifecycle.exception.RetrainInProgressException;
import com.chicu.aimodelops.lifecycle.exception.VersionNotFoundException;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.WatcherState;
import com.chicu.aimodelops.lifecycle.port.MetricSource;
import com.chicu.aimodelops.lifecycle.version.VersionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Надзор за свежей версией после деплоя.
 *
 * Пока активная версия моложе probation-window, живая метрика сравнивается с той,
 * на которой версию приняли. Просадка больше rollback-threshold hysteresis-n раз подряд —
 * автоматический откат на шаг назад через координатор. Заявок на переобучение не выпускает.
 */
@Slf4j
@Component
public class ProbationWatcher implements Watcher {

    private final MetricSource metrics;
    private final VersionManager versionManager;
    private final RetrainCoordinator coordinator;
    private final LifecycleProperties props;
    private final Clock clock;

    private volatile WatcherState state = WatcherState.initial(WatcherType.PROBATION);

    /** только поток наблюдателя */
    private String watchedVersionId;
    private int breaches;

    public ProbationWatcher(MetricSource metrics,
                            VersionManager versionManager,
                            RetrainCoordinator coordinator,
                            LifecycleProperties props,
                            Clock clock) {
        this.metrics = metrics;
        this.versionManager = versionManager;
        this.coordinator = coordinator;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public WatcherType type() {
        return WatcherType.PROBATION;
    }

    @Override
    public Duration interval() {
        return props.getMonitor().getPerformanceInterval();
    }

    @Override
    public WatcherState state() {
        return state;
    }

    @Override
    public Optional<RetrainRequest> check() {
        Instant now = clock.instant();
        LifecycleProperties.Retention retention = props.getRetention();

        ModelVersion active = versionManager.current().orElse(null);
        if (!retention.isAutoRollback() || active == null || !onProbation(active, now, retention.getProbationWindow())) {
            watch(null);
            return Optional.empty();
        }
        watch(active.id());

        String metric = props.getTriggers().getPerformanceMetric();
        Double deployed = active.metrics() != null ? active.metrics().get(metric) : null;
        if (deployed == null) {
            return Optional.empty();
        }

        Double live;
        try {
            Map<String, Double> current = metrics.currentPerformance();
            live = current != null ? current.get(metric) : null;
            if (live == null || live.isNaN()) {
                throw new IllegalStateException("metric '" + metric + "' missing in performance snapshot");
            }
        } catch (Exception e) {
            state = state.failed(now, e.getMessage());
            log.warn("⚠️ WATCHER PROBATION sample failed (x{}): {}", state.consecutiveFailures(), e.getMessage());
            return Optional.empty();
        }

        boolean lowerIsBetter = props.getValidation().getLowerIsBetter().contains(metric);
        double drop = lowerIsBetter ? live - deployed : deployed - live;
        breaches = drop > retention.getRollbackThreshold() ? breaches + 1 : 0;
        state = state.observed(now, live, breaches);

        if (breaches > 0) {
            log.info("🔎 PROBATION {} {}={} vs deployed {} (breach {}/{})",
                    active.id(), metric, live, deployed, breaches, props.getTriggers().getHysteresisN());
        }
        if (breaches < props.getTriggers().getHysteresisN()) {
            return Optional.empty();
        }
        if (!hasRetired()) {
            log.warn("⚠️ PROBATION {} degraded but no retired version to return to", active.id());
            return Optional.empty();
        }

        String cause = String.format(Locale.ROOT, "%s=%.4f vs deployed %.4f, drop %.4f > %.4f",
                metric, live, deployed, drop, retention.getRollbackThreshold());
        try {
            coordinator.rollback(null, cause);
            breaches = 0;
        } catch (RetrainInProgressException e) {
            log.info("⏸ PROBATION auto rollback of {} postponed: {}", active.id(), e.getMessage());
        } catch (VersionNotFoundException e) {
            log.error("❌ PROBATION auto rollback of {} impossible: {}", active.id(), e.getMessage());
        }
        return Optional.empty();
    }

    private static boolean onProbation(ModelVersion active, Instant now, Duration window) {
        return active.createdAt() != null && !now.isAfter(active.createdAt().plus(window));
    }

    private boolean hasRetired() {
        return versionManager.versions().stream().anyMatch(v -> v.status() == ModelStatus.RETIRED);
    }

    private void watch(String versionId) {
        if (versionId == null ? watchedVersionId != null : !versionId.equals(watchedVersionId)) {
            watchedVersionId = versionId;
            breaches = 0;
        }
    }
}
