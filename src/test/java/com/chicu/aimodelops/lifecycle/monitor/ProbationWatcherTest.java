package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.ModelStatus;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.coordinator.RetrainCoordinator;
import com.chicu.aimodelops.lifecycle.exception.RetrainInProgressException;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.port.MetricSource;
import com.chicu.aimodelops.lifecycle.version.VersionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProbationWatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock private MetricSource metrics;
    @Mock private VersionManager versionManager;
    @Mock private RetrainCoordinator coordinator;

    private LifecycleProperties props;
    private ProbationWatcher watcher;

    private final ModelVersion previous = version("v000001", NOW.minus(Duration.ofDays(10)), 0.82, ModelStatus.RETIRED);
    private final ModelVersion fresh = version("v000002", NOW.minus(Duration.ofHours(2)), 0.85, ModelStatus.ACTIVE);

    @BeforeEach
    void setUp() {
        props = new LifecycleProperties();
        props.getTriggers().setHysteresisN(2);
        props.getRetention().setRollbackThreshold(0.05);
        props.getRetention().setProbationWindow(Duration.ofHours(24));
        watcher = new ProbationWatcher(metrics, versionManager, coordinator, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void sustainedDropBelowDeployedMetric_rollsBackOneStep() {
        when(versionManager.current()).thenReturn(Optional.of(fresh));
        when(versionManager.versions()).thenReturn(List.of(previous, fresh));
        when(metrics.currentPerformance()).thenReturn(Map.of("accuracy", 0.71));

        assertTrue(watcher.check().isEmpty());
        verify(coordinator, never()).rollback(any(), anyString());

        assertTrue(watcher.check().isEmpty());
        verify(coordinator).rollback(isNull(), contains("accuracy=0.7100 vs deployed 0.8500"));
    }

    @Test
    void singleDip_isHysteresis_noRollback() {
        when(versionManager.current()).thenReturn(Optional.of(fresh));
        when(metrics.currentPerformance()).thenReturn(
                Map.of("accuracy", 0.71),
                Map.of("accuracy", 0.84),
                Map.of("accuracy", 0.70));

        watcher.check();
        watcher.check();
        watcher.check();

        assertEquals(1, watcher.state().consecutiveBreaches());
        verifyNoInteractions(coordinator);
    }

    @Test
    void dropWithinThreshold_isTolerated() {
        when(versionManager.current()).thenReturn(Optional.of(fresh));
        when(metrics.currentPerformance()).thenReturn(Map.of("accuracy", 0.81));

        watcher.check();
        watcher.check();
        watcher.check();

        verifyNoInteractions(coordinator);
        assertEquals(0.81, watcher.state().lastValue(), 1e-9);
    }

    @Test
    void versionPastProbationWindow_isNotWatched() {
        ModelVersion settled = version("v000002", NOW.minus(Duration.ofDays(2)), 0.85, ModelStatus.ACTIVE);
        when(versionManager.current()).thenReturn(Optional.of(settled));

        watcher.check();
        watcher.check();

        verifyNoInteractions(metrics, coordinator);
    }

    @Test
    void lowerIsBetterMetric_dropMeansRise() {
        props.getTriggers().setPerformanceMetric("rmse");
        props.getValidation().setLowerIsBetter(Set.of("rmse"));
        ModelVersion regression = ModelVersion.builder()
                .id("v000002").createdAt(NOW.minus(Duration.ofHours(1)))
                .artifactRef("versions/v000002").metrics(Map.of("rmse", 0.20))
                .status(ModelStatus.ACTIVE).schemaVersion("1").build();
        when(versionManager.current()).thenReturn(Optional.of(regression));
        when(versionManager.versions()).thenReturn(List.of(previous, regression));
        when(metrics.currentPerformance()).thenReturn(Map.of("rmse", 0.31));

        watcher.check();
        watcher.check();

        verify(coordinator).rollback(isNull(), contains("rmse=0.3100"));
    }

    @Test
    void noRetiredVersion_noRollbackAttempt() {
        when(versionManager.current()).thenReturn(Optional.of(fresh));
        when(versionManager.versions()).thenReturn(List.of(fresh));
        when(metrics.currentPerformance()).thenReturn(Map.of("accuracy", 0.60));

        watcher.check();
        watcher.check();

        verifyNoInteractions(coordinator);
    }

    @Test
    void retrainInFlight_postponesRollbackToNextCheck() {
        when(versionManager.current()).thenReturn(Optional.of(fresh));
        when(versionManager.versions()).thenReturn(List.of(previous, fresh));
        when(metrics.currentPerformance()).thenReturn(Map.of("accuracy", 0.60));
        when(coordinator.rollback(isNull(), anyString()))
                .thenThrow(new RetrainInProgressException("retrain attempt a-1 is in flight"))
                .thenReturn(previous.withStatus(ModelStatus.ACTIVE));

        watcher.check();
        watcher.check();
        watcher.check();

        verify(coordinator, times(2)).rollback(isNull(), anyString());
    }

    @Test
    void autoRollbackDisabled_onlyObserves() {
        props.getRetention().setAutoRollback(false);
        when(versionManager.current()).thenReturn(Optional.of(fresh));

        watcher.check();
        watcher.check();

        verifyNoInteractions(metrics, coordinator);
    }

    @Test
    void sampleFailure_isCountedInState() {
        when(versionManager.current()).thenReturn(Optional.of(fresh));
        when(metrics.currentPerformance()).thenThrow(new IllegalStateException("metrics endpoint down"));

        assertTrue(watcher.check().isEmpty());

        assertEquals(1, watcher.state().consecutiveFailures());
        assertEquals("metrics endpoint down", watcher.state().lastError());
    }

    private static ModelVersion version(String id, Instant createdAt, double accuracy, ModelStatus status) {
        return ModelVersion.builder()
                .id(id)
                .createdAt(createdAt)
                .artifactRef("versions/" + id)
                .metrics(Map.of("accuracy", accuracy))
                .status(status)
                .schemaVersion("1")
                .build();
    }
}
