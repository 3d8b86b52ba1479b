package com.chicu.aimodelops.lifecycle.coordinator;

import com.chicu.aimodelops.common.enums.RetrainOutcome;
import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.history.RetrainHistoryService;
import com.chicu.aimodelops.lifecycle.model.Dataset;
import com.chicu.aimodelops.lifecycle.model.LifecycleStatus;
import com.chicu.aimodelops.lifecycle.model.RetrainHistoryEntry;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import com.chicu.aimodelops.lifecycle.model.ValidatorReport;
import com.chicu.aimodelops.lifecycle.monitor.RetrainRequestQueue;
import com.chicu.aimodelops.lifecycle.port.ArtifactStore;
import com.chicu.aimodelops.lifecycle.port.ModelTrainer;
import com.chicu.aimodelops.lifecycle.port.Notifier;
import com.chicu.aimodelops.lifecycle.port.TrainingDataLoader;
import com.chicu.aimodelops.lifecycle.validation.CandidateValidator;
import com.chicu.aimodelops.lifecycle.version.VersionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Настоящие потоки: dispatcher + worker, обучение висит на защёлке.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RetrainCoordinatorConcurrencyTest {

    private static final Dataset TRAIN = new Dataset("ds-train", "train", 100);
    private static final Dataset TEST = new Dataset("ds-test", "test", 50);

    @Mock private TrainingDataLoader dataLoader;
    @Mock private ModelTrainer trainer;
    @Mock private CandidateValidator validator;
    @Mock private VersionManager versionManager;
    @Mock private ArtifactStore store;
    @Mock private RetrainHistoryService history;
    @Mock private Notifier notifier;

    private final RetrainRequestQueue queue = new RetrainRequestQueue();
    private final LifecycleStatus status = new LifecycleStatus();
    private final Clock clock = Clock.systemUTC();

    private final AtomicInteger activeFits = new AtomicInteger();
    private final AtomicInteger maxActiveFits = new AtomicInteger();
    private final AtomicInteger fitCalls = new AtomicInteger();
    private final CountDownLatch firstFitEntered = new CountDownLatch(1);
    private final CountDownLatch releaseFits = new CountDownLatch(1);

    private ResourceGovernor governor;
    private RetrainCoordinator coordinator;

    @BeforeEach
    void setUp() {
        LifecycleProperties props = new LifecycleProperties();
        props.getMonitor().setShutdownGrace(Duration.ofSeconds(2));
        governor = new ResourceGovernor(props, clock);
        coordinator = new RetrainCoordinator(queue, dataLoader, trainer, validator, versionManager, store,
                governor, history, notifier, status, props, clock);

        when(versionManager.current()).thenReturn(Optional.empty());
        when(versionManager.nextVersionId()).thenReturn("v000001", "v000002", "v000003");
        when(dataLoader.loadTrainingData()).thenReturn(TRAIN);
        when(dataLoader.loadTestData()).thenReturn(TEST);
        when(store.write(anyString(), any())).thenAnswer(inv -> "staging/" + inv.getArgument(0));
        when(validator.validate(any(), any(), any())).thenReturn(ValidatorReport.builder()
                .accepted(false)
                .failedGate("minimum_requirements")
                .reasons(List.of("minimum_requirements_gate_failed: accuracy=0.5000 < 0.7000"))
                .build());
        when(trainer.fit(anyString(), any(), any())).thenAnswer(inv -> {
            fitCalls.incrementAndGet();
            int now = activeFits.incrementAndGet();
            maxActiveFits.accumulateAndGet(now, Math::max);
            try {
                firstFitEntered.countDown();
                releaseFits.await(5, TimeUnit.SECONDS);
                return new TrainedModel("mk", "1", new byte[]{1});
            } finally {
                activeFits.decrementAndGet();
            }
        });
    }

    @AfterEach
    void tearDown() {
        releaseFits.countDown();
        coordinator.stop();
        governor.shutdown();
    }

    @Test
    void requestsDuringAttempt_waitInPendingNext_highestPriorityWins() throws Exception {
        coordinator.start();

        assertTrue(queue.offer(RetrainRequest.of(RetrainReason.SCHEDULED, clock.instant(), "weekly")));
        assertTrue(firstFitEntered.await(3, TimeUnit.SECONDS));
        assertTrue(status.isRetraining());

        queue.offer(RetrainRequest.of(RetrainReason.DATA_DRIFT, clock.instant(), "psi=0.4"));
        queue.offer(RetrainRequest.of(RetrainReason.PERFORMANCE_DEGRADATION, clock.instant(), "accuracy=0.6"));

        waitUntil(() -> coordinator.getPendingNext() != null
                && coordinator.getPendingNext().reason() == RetrainReason.PERFORMANCE_DEGRADATION
                && queue.size() == 0);
        // проигравшая заявка отпущена — её причина снова принимается
        waitUntil(() -> !queue.isAdmitted(RetrainReason.DATA_DRIFT));

        releaseFits.countDown();
        waitUntil(() -> fitCalls.get() == 2 && !status.isRetraining() && coordinator.getPendingNext() == null);

        assertEquals(1, maxActiveFits.get());

        ArgumentCaptor<RetrainHistoryEntry> entries = ArgumentCaptor.forClass(RetrainHistoryEntry.class);
        verify(history, timeout(2_000).times(2)).append(entries.capture());
        assertEquals(RetrainReason.SCHEDULED, entries.getAllValues().get(0).request().reason());
        assertEquals(RetrainReason.PERFORMANCE_DEGRADATION, entries.getAllValues().get(1).request().reason());
        entries.getAllValues().forEach(e -> assertEquals(RetrainOutcome.REJECTED, e.outcome()));
    }

    @Test
    void burstOfRequests_neverTrainsConcurrently() throws Exception {
        releaseFits.countDown();
        coordinator.start();

        for (int round = 0; round < 5; round++) {
            for (RetrainReason reason : RetrainReason.values()) {
                queue.offer(RetrainRequest.of(reason, clock.instant(), "round " + round));
            }
            Thread.sleep(20);
        }

        waitUntil(() -> queue.size() == 0 && !status.isRetraining() && coordinator.getPendingNext() == null);
        Thread.sleep(50);
        waitUntil(() -> !status.isRetraining());

        assertTrue(fitCalls.get() >= 1);
        assertEquals(1, maxActiveFits.get());
    }

    private static void waitUntil(BooleanSupplier cond) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!cond.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not met in time");
            Thread.sleep(10);
        }
    }
}
