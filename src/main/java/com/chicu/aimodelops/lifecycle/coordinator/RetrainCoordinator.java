package com.chicu.aimodelops.lifecycle.coordinator;

import com.chicu.aimodelops.common.enums.AlertSeverity;
import com.chicu.aimodelops.common.enums.CoordinatorState;
import com.chicu.aimodelops.common.enums.ModelStatus;
import com.chicu.aimodelops.common.enums.PhaseStatus;
import com.chicu.aimodelops.common.enums.RetrainOutcome;
import com.chicu.aimodelops.common.util.AttemptIds;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.exception.PhaseTimeoutException;
import com.chicu.aimodelops.lifecycle.exception.RetrainInProgressException;
import com.chicu.aimodelops.lifecycle.exception.SingleFlightViolationException;
import com.chicu.aimodelops.lifecycle.history.RetrainHistoryService;
import com.chicu.aimodelops.lifecycle.model.LifecycleStatus;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.RetrainHistoryEntry;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import com.chicu.aimodelops.lifecycle.model.TrainingData;
import com.chicu.aimodelops.lifecycle.model.ValidatorReport;
import com.chicu.aimodelops.lifecycle.monitor.RetrainRequestQueue;
import com.chicu.aimodelops.lifecycle.port.ArtifactStore;
import com.chicu.aimodelops.lifecycle.port.ModelTrainer;
import com.chicu.aimodelops.lifecycle.port.Notifier;
import com.chicu.aimodelops.lifecycle.port.TrainingDataLoader;
import com.chicu.aimodelops.lifecycle.validation.CandidateValidator;
import com.chicu.aimodelops.lifecycle.version.VersionManager;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Единственный потребитель очереди заявок и единственный владелец состояния попытки.
 *
 * IDLE → FETCHING_DATA → TRAINING → VALIDATING → DEPLOYING | ROLLING_BACK → IDLE.
 * Одновременно выполняется не больше одной попытки; заявка, пришедшая во время попытки,
 * ждёт в одноместном буфере pending-next (побеждает более приоритетная).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainCoordinator {

    private final RetrainRequestQueue queue;
    private final TrainingDataLoader dataLoader;
    private final ModelTrainer trainer;
    private final CandidateValidator validator;
    private final VersionManager versionManager;
    private final ArtifactStore store;
    private final ResourceGovernor governor;
    private final RetrainHistoryService history;
    private final Notifier notifier;
    private final LifecycleStatus status;
    private final LifecycleProperties props;
    private final Clock clock;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "retrain-worker");
        t.setDaemon(true);
        return t;
    });

    private volatile Thread dispatcher;
    private volatile boolean running;

    /** guarded by this */
    private boolean attemptRunning;
    /** guarded by this */
    private RetrainRequest pendingNext;

    /** только поток попытки */
    private int consecutiveFetchFailures;

    // ==============================================================
    // ▶️ START / 🛑 STOP
    // ==============================================================

    public synchronized void start() {
        if (running) return;
        running = true;

        Thread t = new Thread(this::dispatchLoop, "retrain-dispatcher");
        t.setDaemon(true);
        dispatcher = t;
        t.start();

        log.info("🧠 RetrainCoordinator started");
    }

    @PreDestroy
    public void stop() {
        Thread t;
        synchronized (this) {
            if (!running) return;
            running = false;
            t = dispatcher;
        }

        log.info("🛑 RetrainCoordinator stopping…");
        if (t != null) t.interrupt();

        worker.shutdown();
        try {
            Duration grace = props.getMonitor().getShutdownGrace();
            if (!worker.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("⚠️ retrain attempt still running after {}, interrupting", grace);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized RetrainRequest getPendingNext() {
        return pendingNext;
    }

    // ==============================================================
    // dispatch
    // ==============================================================

    private void dispatchLoop() {
        while (running) {
            try {
                RetrainRequest request = queue.take();
                dispatch(request);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("❌ dispatcher error: {}", e.getMessage(), e);
            }
        }
        log.info("🛑 retrain-dispatcher exited");
    }

    synchronized void dispatch(RetrainRequest request) {
        if (status.isHalted()) {
            log.error("❌ coordinator HALTED, request dropped reason={}", request.reason());
            queue.release(request.reason());
            return;
        }

        if (attemptRunning) {
            if (pendingNext == null) {
                pendingNext = request;
                log.info("⏸ PENDING-NEXT reason={} (attempt in flight)", request.reason());
            } else if (request.compareTo(pendingNext) < 0) {
                drop(pendingNext, "displaced by " + request.reason());
                pendingNext = request;
                log.info("⏸ PENDING-NEXT replaced by higher priority reason={}", request.reason());
            } else {
                drop(request, "pending-next holds " + pendingNext.reason());
            }
            return;
        }

        attemptRunning = true;
        try {
            worker.execute(() -> runChain(request));
        } catch (RejectedExecutionException e) {
            attemptRunning = false;
            queue.release(request.reason());
            log.warn("⚠️ worker is shut down, request dropped reason={}", request.reason());
        }
    }

    private void drop(RetrainRequest request, String why) {
        queue.release(request.reason());
        log.warn("🗑 REQUEST DROPPED reason={} detail={} ({})", request.reason(), request.detail(), why);
    }

    private void runChain(RetrainRequest first) {
        RetrainRequest next = first;
        while (next != null) {
            try {
                runAttempt(next);
            } catch (SingleFlightViolationException e) {
                log.error("❌ {}", e.getMessage());
            } catch (RuntimeException e) {
                log.error("❌ attempt crashed reason={}: {}", next.reason(), e.getMessage(), e);
            }

            synchronized (this) {
                next = pendingNext;
                pendingNext = null;
                if (next != null && status.isHalted()) {
                    drop(next, "coordinator halted");
                    next = null;
                }
                if (next == null) {
                    attemptRunning = false;
                }
            }
        }
    }

    // ==============================================================
    // 🧠 ATTEMPT
    // ==============================================================

    /**
     * Одна попытка целиком, синхронно. Всегда даёт одну запись аудита и одно уведомление.
     *
     * @throws SingleFlightViolationException если попытка уже идёт; координатор при этом останавливается
     */
    public RetrainHistoryEntry runAttempt(RetrainRequest request) {
        String attemptId = AttemptIds.newAttemptId();

        if (!status.tryBeginRetrain(attemptId)) {
            String inFlight = status.getCurrentAttemptId();
            status.setState(CoordinatorState.HALTED);
            queue.release(request.reason());

            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("attemptId", attemptId);
            ctx.put("runningAttemptId", inFlight);
            ctx.put("reason", request.reason().code());
            notifier.send(AlertSeverity.CRITICAL,
                    "Two concurrent retrain attempts detected, coordinator halted", ctx);

            throw new SingleFlightViolationException(
                    "retrain attempt " + attemptId + " started while " + inFlight + " is in flight");
        }

        Attempt a = new Attempt(attemptId, request, clock.instant());
        log.info("🧠 RETRAIN START attempt={} reason={} detail={}", attemptId, request.reason(), request.detail());

        try {
            a.baseline = versionManager.current().orElse(null);
            execute(a);
        } catch (RuntimeException e) {
            log.error("❌ RETRAIN attempt={} unexpected failure: {}", attemptId, e.getMessage(), e);
            discardStaged(a);
            a.finish(RetrainOutcome.ERROR, AlertSeverity.ERROR, "Unexpected failure: " + e.getMessage());
        }

        RetrainHistoryEntry entry = a.toEntry(clock.instant());
        try {
            try {
                history.append(entry);
            } catch (RuntimeException e) {
                log.error("❌ history append failed attempt={}: {}", attemptId, e.getMessage(), e);
                a.auditLost(e);
            }
            notifier.send(a.severity, a.message, a.context());
        } finally {
            if (!status.isHalted()) {
                status.setState(CoordinatorState.IDLE);
            }
            status.endRetrain(a.outcome);
            queue.release(request.reason());
        }

        log.info("🏁 RETRAIN DONE attempt={} outcome={} tookMs={}",
                attemptId, a.outcome, Duration.between(a.startedAt, entry.finishedAt()).toMillis());
        return entry;
    }

    private void execute(Attempt a) {
        LifecycleProperties.Retrain cfg = props.getRetrain();

        // ---------- FETCHING_DATA
        status.setState(CoordinatorState.FETCHING_DATA);
        FetchResult fetch = fetch(cfg);
        if (!fetch.isCompleted()) {
            consecutiveFetchFailures++;
            a.extra.put("consecutiveFetchFailures", consecutiveFetchFailures);
            boolean timedOut = fetch.status() == PhaseStatus.TIMED_OUT;
            String msg = (timedOut ? "Data fetch timed out: " : "Data fetch failed: ") + fetch.error();
            if (consecutiveFetchFailures >= cfg.getFetchFailureAlertThreshold()) {
                msg += " (" + consecutiveFetchFailures + " consecutive failures)";
            }
            if (timedOut) {
                a.finish(RetrainOutcome.ABORTED, AlertSeverity.WARNING, msg);
            } else {
                a.finish(RetrainOutcome.ERROR, AlertSeverity.ERROR, msg);
            }
            return;
        }
        consecutiveFetchFailures = 0;
        TrainingData data = fetch.data();

        // ---------- headroom
        GovernorDecision headroom = governor.checkHeadroom();
        if (!headroom.allowed()) {
            a.finish(RetrainOutcome.ABORTED, AlertSeverity.WARNING, "Not enough resources to train: " + headroom.reason());
            return;
        }

        // ---------- TRAINING
        status.setState(CoordinatorState.TRAINING);
        Duration ceiling = cfg.getMaxRetrainingTime();
        String attemptId = a.attemptId;
        TrainResult train = governor.train(attemptId,
                () -> trainer.fit(attemptId, data.training(), ceiling),
                ceiling,
                () -> trainer.cancel(attemptId));

        if (train.status() == PhaseStatus.TIMED_OUT) {
            log.warn("⏱ RETRAIN attempt={} training aborted after {}", attemptId, train.elapsed());
            a.finish(RetrainOutcome.ABORTED, AlertSeverity.WARNING,
                    "Training exceeded max retraining time " + ceiling);
            return;
        }
        if (train.status() == PhaseStatus.FAILED) {
            a.finish(RetrainOutcome.ERROR, AlertSeverity.ERROR, "Training failed: " + train.error());
            return;
        }
        TrainedModel model = train.model();

        String versionId = versionManager.nextVersionId();
        a.candidateId = versionId;
        a.stagedRef = store.write(versionId, model);

        // ---------- VALIDATING
        status.setState(CoordinatorState.VALIDATING);
        ValidatorReport report;
        try {
            report = governor.callWithin("validation",
                    () -> validator.validate(model, a.baseline, data.test()),
                    cfg.getValidationTimeout());
        } catch (PhaseTimeoutException e) {
            discardStaged(a);
            a.finish(RetrainOutcome.ABORTED, AlertSeverity.WARNING, "Validation timed out: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            discardStaged(a);
            a.finish(RetrainOutcome.ERROR, AlertSeverity.ERROR, "Validation failed: " + e.getMessage());
            return;
        }
        a.report = report;

        if (!report.accepted()) {
            discardStaged(a);
            log.warn("🚫 RETRAIN attempt={} rejected: {} metrics={}", attemptId, report.reasons(), report.metrics());
            a.finish(RetrainOutcome.REJECTED, AlertSeverity.WARNING,
                    "Candidate " + versionId + " rejected: " + String.join("; ", report.reasons()));
            return;
        }

        ModelVersion candidate = ModelVersion.builder()
                .id(versionId)
                .createdAt(clock.instant())
                .artifactRef(a.stagedRef)
                .metrics(candidateMetrics(report))
                .status(ModelStatus.CANDIDATE)
                .schemaVersion(model.schemaVersion())
                .build();

        // ---------- DEPLOYING
        status.setState(CoordinatorState.DEPLOYING);
        try {
            ModelVersion promoted = governor.callWithin("deploy",
                    () -> versionManager.promote(candidate),
                    cfg.getDeployTimeout());
            a.stagedRef = null;
            a.finish(RetrainOutcome.DEPLOYED, AlertSeverity.INFO,
                    "Deployed " + promoted.id() + " (previous " + (a.baseline != null ? a.baseline.id() : "none") + ")");
        } catch (RuntimeException e) {
            log.error("❌ RETRAIN attempt={} promote of {} failed: {}", attemptId, versionId, e.getMessage(), e);
            rollBack(a, candidate, e);
        }
    }

    private FetchResult fetch(LifecycleProperties.Retrain cfg) {
        try {
            TrainingData data = governor.callWithin("fetch",
                    () -> new TrainingData(dataLoader.loadTrainingData(), dataLoader.loadTestData()),
                    cfg.getFetchTimeout());
            String tooSmall = tooSmall(data, cfg);
            if (tooSmall != null) {
                log.warn("⚠️ data fetch unusable: {}", tooSmall);
                return FetchResult.failed(tooSmall);
            }
            return FetchResult.completed(data);
        } catch (PhaseTimeoutException e) {
            return FetchResult.timedOut(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("⚠️ data fetch failed: {}", e.getMessage());
            return FetchResult.failed(e.getMessage());
        }
    }

    private static String tooSmall(TrainingData data, LifecycleProperties.Retrain cfg) {
        if (data.training() == null || data.test() == null) {
            return "loader returned no dataset";
        }
        if (data.training().rows() < cfg.getMinTrainingRows()) {
            return "training set too small: " + data.training().rows() + " < " + cfg.getMinTrainingRows() + " rows";
        }
        if (data.test().rows() < cfg.getMinTestRows()) {
            return "test set too small: " + data.test().rows() + " < " + cfg.getMinTestRows() + " rows";
        }
        return null;
    }

    /**
     * Возврат к baseline после неудачного promote. Restore ограничен deploy-таймаутом:
     * зависший promote может держать монитор VersionManager.
     */
    private void rollBack(Attempt a, ModelVersion candidate, RuntimeException cause) {
        status.setState(CoordinatorState.ROLLING_BACK);
        a.stagedRef = null;
        String restoredTo = a.baseline != null ? a.baseline.id() : "empty pointer";
        try {
            governor.callWithin("rollback", () -> {
                versionManager.restore(a.baseline, candidate);
                return null;
            }, props.getRetrain().getDeployTimeout());
            if (cause instanceof PhaseTimeoutException) {
                a.finish(RetrainOutcome.ABORTED, AlertSeverity.WARNING,
                        "Deploy of " + candidate.id() + " timed out (" + cause.getMessage() + "), restored " + restoredTo);
            } else {
                a.finish(RetrainOutcome.ERROR, AlertSeverity.ERROR,
                        "Promote of " + candidate.id() + " failed (" + cause.getMessage() + "), restored " + restoredTo);
            }
        } catch (RuntimeException e) {
            status.setState(CoordinatorState.FAILED);
            status.setRequiresIntervention(true);
            log.error("❌ ROLLBACK FAILED attempt={} candidate={} baseline={}: {}",
                    a.attemptId, candidate.id(), a.baseline != null ? a.baseline.id() : "none", e.getMessage(), e);
            a.finish(RetrainOutcome.ERROR, AlertSeverity.CRITICAL,
                    "Rollback after failed promote of " + candidate.id() + " failed: " + e.getMessage()
                            + ". Manual intervention required");
        }
    }

    private void discardStaged(Attempt a) {
        if (a.stagedRef == null) return;
        try {
            store.delete(a.stagedRef);
        } catch (RuntimeException e) {
            log.warn("⚠️ cannot discard staged candidate {}: {}", a.stagedRef, e.getMessage());
        }
        a.stagedRef = null;
    }

    private static Map<String, Double> candidateMetrics(ValidatorReport report) {
        Map<String, Double> out = new LinkedHashMap<>();
        report.metrics().forEach((k, v) -> {
            if (k.startsWith("candidate.")) {
                out.put(k.substring("candidate.".length()), v);
            }
        });
        return out;
    }

    // ==============================================================
    // ↩️ ROLLBACK
    // ==============================================================

    /**
     * Операторский откат. Под тем же монитором, что и dispatch, поэтому попытка не стартует посреди отката.
     */
    public ModelVersion rollback(String targetId) {
        return rollback(targetId, null);
    }

    /**
     * Откат; {@code automaticCause != null} означает, что его инициировал надзор за свежей версией.
     */
    public synchronized ModelVersion rollback(String targetId, String automaticCause) {
        if (attemptRunning || status.isRetraining()) {
            throw new RetrainInProgressException("retrain attempt " + status.getCurrentAttemptId() + " is in flight");
        }

        CoordinatorState before = status.getState();
        status.setState(CoordinatorState.ROLLING_BACK);
        try {
            String from = status.getCurrentVersionId();
            ModelVersion active = versionManager.rollback(targetId);

            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("from", from);
            ctx.put("to", active.id());
            ctx.put("target", targetId);
            if (automaticCause == null) {
                notifier.send(AlertSeverity.WARNING, "Manual rollback " + from + " -> " + active.id(), ctx);
            } else {
                ctx.put("automatic", true);
                ctx.put("cause", automaticCause);
                log.warn("↩️ AUTO ROLLBACK {} -> {} ({})", from, active.id(), automaticCause);
                notifier.send(AlertSeverity.WARNING,
                        "Automatic rollback " + from + " -> " + active.id() + " (" + automaticCause + ")", ctx);
            }
            return active;
        } finally {
            status.setState(before == CoordinatorState.HALTED ? CoordinatorState.HALTED : CoordinatorState.IDLE);
        }
    }

    // ==============================================================
    // attempt bookkeeping
    // ==============================================================

    private static final class Attempt {
        final String attemptId;
        final RetrainRequest request;
        final Instant startedAt;
        final Map<String, Object> extra = new LinkedHashMap<>();

        ModelVersion baseline;
        String candidateId;
        String stagedRef;
        ValidatorReport report;

        RetrainOutcome outcome = RetrainOutcome.ERROR;
        AlertSeverity severity = AlertSeverity.ERROR;
        String message = "attempt did not finish";

        Attempt(String attemptId, RetrainRequest request, Instant startedAt) {
            this.attemptId = attemptId;
            this.request = request;
            this.startedAt = startedAt;
        }

        void finish(RetrainOutcome outcome, AlertSeverity severity, String message) {
            this.outcome = outcome;
            this.severity = severity;
            this.message = message;
        }

        /** Запись аудита потеряна: уведомление должно это нести и быть не ниже ERROR. */
        void auditLost(RuntimeException e) {
            extra.put("historyWriteFailed", true);
            extra.put("historyError", e.getMessage());
            if (severity.ordinal() < AlertSeverity.ERROR.ordinal()) {
                severity = AlertSeverity.ERROR;
            }
            message = message + " (audit write failed: " + e.getMessage() + ")";
        }

        Map<String, Object> context() {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("attemptId", attemptId);
            ctx.put("reason", request.reason().code());
            ctx.put("outcome", outcome.name());
            ctx.put("candidate", candidateId);
            ctx.put("baseline", baseline != null ? baseline.id() : null);
            ctx.putAll(extra);
            return ctx;
        }

        RetrainHistoryEntry toEntry(Instant finishedAt) {
            return RetrainHistoryEntry.builder()
                    .attemptId(attemptId)
                    .request(request)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .outcome(outcome)
                    .candidateVersionId(candidateId)
                    .baselineVersionId(baseline != null ? baseline.id() : null)
                    .validatorReport(report)
                    .message(message)
                    .build();
        }
    }
}
