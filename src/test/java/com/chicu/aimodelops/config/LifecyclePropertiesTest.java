package com.chicu.aimodelops.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LifecyclePropertiesTest {

    @Test
    void defaults_areValid() {
        assertDoesNotThrow(() -> new LifecycleProperties().validate());
    }

    @Test
    void thresholdOutsideUnitRange_rejected() {
        LifecycleProperties props = new LifecycleProperties();
        props.getTriggers().setPerformanceThreshold(1.5);

        IllegalStateException e = assertThrows(IllegalStateException.class, props::validate);
        assertTrue(e.getMessage().contains("triggers.performance-threshold"), e.getMessage());
    }

    @Test
    void allProblems_reportedAtOnce() {
        LifecycleProperties props = new LifecycleProperties();
        props.getMonitor().setDriftInterval(Duration.ZERO);
        props.getTriggers().setHysteresisN(0);
        props.getRetention().setMaxVersions(0);

        IllegalStateException e = assertThrows(IllegalStateException.class, props::validate);
        assertTrue(e.getMessage().contains("monitor.drift-interval"));
        assertTrue(e.getMessage().contains("triggers.hysteresis-n"));
        assertTrue(e.getMessage().contains("retention.max-versions"));
    }

    @Test
    void emptyTrackedMetrics_rejected() {
        LifecycleProperties props = new LifecycleProperties();
        props.getValidation().getTrackedMetrics().clear();

        assertThrows(IllegalStateException.class, props::validate);
    }

    @Test
    void probationAndMinRowsSettings_validated() {
        LifecycleProperties props = new LifecycleProperties();
        props.getRetention().setRollbackThreshold(-0.1);
        props.getRetention().setProbationWindow(Duration.ZERO);
        props.getRetrain().setMinTestRows(0);

        IllegalStateException e = assertThrows(IllegalStateException.class, props::validate);
        assertTrue(e.getMessage().contains("retention.rollback-threshold"), e.getMessage());
        assertTrue(e.getMessage().contains("retention.probation-window"), e.getMessage());
        assertTrue(e.getMessage().contains("retrain.min-test-rows"), e.getMessage());
    }
}
