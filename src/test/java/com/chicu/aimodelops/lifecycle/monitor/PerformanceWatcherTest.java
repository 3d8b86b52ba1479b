package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.port.MetricSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PerformanceWatcherTest {

    @Mock private MetricSource metrics;

    private PerformanceWatcher watcher;

    @BeforeEach
    void setUp() {
        LifecycleProperties props = new LifecycleProperties();
        props.getTriggers().setPerformanceMetric("accuracy");
        props.getTriggers().setPerformanceThreshold(0.75);
        props.getTriggers().setHysteresisN(3);

        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        watcher = new PerformanceWatcher(metrics, props, clock);
    }

    @Test
    void singleBreachDoesNotEmit_threeConsecutiveDo() {
        when(metrics.currentPerformance()).thenReturn(Map.of("accuracy", 0.60));

        assertTrue(watcher.check().isEmpty());
        assertTrue(watcher.check().isEmpty());
        Optional<RetrainRequest> third = watcher.check();

        assertTrue(third.isPresent());
        assertEquals(RetrainReason.PERFORMANCE_DEGRADATION, third.get().reason());
        assertTrue(third.get().detail().contains("accuracy"));
        // после заявки счётчик обнулён
        assertEquals(0, watcher.state().consecutiveBreaches());
        assertTrue(watcher.check().isEmpty());
    }

    @Test
    void healthySampleResetsBreachCounter() {
        when(metrics.currentPerformance()).thenReturn(
                Map.of("accuracy", 0.60),
                Map.of("accuracy", 0.60),
                Map.of("accuracy", 0.90),
                Map.of("accuracy", 0.60),
                Map.of("accuracy", 0.60));

        for (int i = 0; i < 5; i++) {
            assertTrue(watcher.check().isEmpty(), "tick " + i);
        }
        assertEquals(2, watcher.state().consecutiveBreaches());
        assertEquals(0.60, watcher.state().lastValue(), 1e-9);
    }

    @Test
    void sourceFailureIsRecorded_notThrown() {
        when(metrics.currentPerformance()).thenThrow(new IllegalStateException("sidecar down"));

        assertTrue(watcher.check().isEmpty());
        assertTrue(watcher.check().isEmpty());

        assertEquals(2, watcher.state().consecutiveFailures());
        assertEquals("sidecar down", watcher.state().lastError());
    }

    @Test
    void missingMetricCountsAsFailure_andSuccessClearsFailures() {
        when(metrics.currentPerformance()).thenReturn(Map.of("recall", 0.9), Map.of("accuracy", 0.9));

        watcher.check();
        assertEquals(1, watcher.state().consecutiveFailures());

        watcher.check();
        assertEquals(0, watcher.state().consecutiveFailures());
        assertNull(watcher.state().lastError());
    }
}
