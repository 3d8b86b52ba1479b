package com.chicu.aimodelops.lifecycle.coordinator;

import com.chicu.aimodelops.common.enums.PhaseStatus;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.exception.PhaseTimeoutException;
import com.chicu.aimodelops.lifecycle.model.ResourceUsage;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import com.chicu.aimodelops.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ResourceGovernorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private LifecycleProperties props;
    private ResourceGovernor governor;

    @BeforeEach
    void setUp() {
        props = new LifecycleProperties();
        governor = new ResourceGovernor(props, clock);
    }

    @AfterEach
    void tearDown() {
        governor.shutdown();
    }

    @Test
    void noSample_allowsTraining() {
        assertTrue(governor.checkHeadroom().allowed());
        assertTrue(governor.latest().isEmpty());
    }

    @Test
    void freshOverloadedSample_deniesWithReason() {
        governor.record(new ResourceUsage(0.5, 0.95, 0.1, clock.instant()));

        GovernorDecision d = governor.checkHeadroom();

        assertFalse(d.allowed());
        assertEquals("memory=0.95 > 0.90", d.reason());
    }

    @Test
    void staleSample_isIgnored() {
        governor.record(new ResourceUsage(0.99, 0.99, 0.99, clock.instant()));
        clock.advance(props.getRetrain().getResourceSampleMaxAge().plusSeconds(1));

        assertTrue(governor.checkHeadroom().allowed());
    }

    @Test
    void sampleWithinLimits_allows() {
        governor.record(new ResourceUsage(0.9, 0.9, 0.9, clock.instant()));

        assertTrue(governor.checkHeadroom().allowed(), "threshold itself is not a breach");
    }

    @Test
    void callWithin_timesOut() {
        PhaseTimeoutException e = assertThrows(PhaseTimeoutException.class, () ->
                governor.callWithin("fetch", () -> {
                    Thread.sleep(5_000);
                    return "late";
                }, Duration.ofMillis(50)));

        assertEquals("fetch", e.getPhase());
    }

    @Test
    void callWithin_rethrowsPhaseException() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                governor.callWithin("validation", () -> {
                    throw new IllegalArgumentException("bad test set");
                }, Duration.ofSeconds(1)));

        assertEquals("bad test set", e.getMessage());
    }

    @Test
    void train_timeout_interruptsFitAndCallsCancel() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicBoolean cancelled = new AtomicBoolean();

        TrainResult r = governor.train("a-1", () -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return new TrainedModel("mk", "1", new byte[]{1});
        }, Duration.ofMillis(50), () -> cancelled.set(true));

        assertEquals(PhaseStatus.TIMED_OUT, r.status());
        assertTrue(cancelled.get());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void train_completed() {
        TrainResult r = governor.train("a-2", () -> new TrainedModel("mk", "1", new byte[]{1, 2}),
                Duration.ofSeconds(1), () -> fail("cancel must not be called"));

        assertEquals(PhaseStatus.COMPLETED, r.status());
        assertEquals(2, r.model().payload().length);
    }

    @Test
    void train_nullModel_isFailure() {
        TrainResult r = governor.train("a-3", () -> null, Duration.ofSeconds(1), () -> { });

        assertEquals(PhaseStatus.FAILED, r.status());
    }
}
