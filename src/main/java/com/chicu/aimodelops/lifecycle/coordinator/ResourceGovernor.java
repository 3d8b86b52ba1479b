package com.chicu.aimodelops.lifecycle.coordinator;

import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.exception.PhaseTimeoutException;
import com.chicu.aimodelops.lifecycle.model.ResourceUsage;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Сторож ресурсов попытки: запас по CPU/RAM/диску перед обучением
 * и жёсткие таймауты фаз (для обучения — max-retraining-time с отменой fit).
 */
@Slf4j
@Component
public class ResourceGovernor {

    private final LifecycleProperties props;
    private final Clock clock;

    private final AtomicReference<ResourceUsage> latest = new AtomicReference<>();
    private final AtomicInteger threadSeq = new AtomicInteger();

    private final ExecutorService phaseExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r);
        t.setDaemon(true);
        t.setName("retrain-phase-" + threadSeq.incrementAndGet());
        return t;
    });

    public ResourceGovernor(LifecycleProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public void record(ResourceUsage usage) {
        if (usage != null) {
            latest.set(usage);
        }
    }

    public Optional<ResourceUsage> latest() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * Отказ только по свежему замеру; без замера (или по устаревшему) обучение разрешено.
     */
    public GovernorDecision checkHeadroom() {
        ResourceUsage u = latest.get();
        if (u == null) {
            return GovernorDecision.allow("no resource sample yet");
        }

        Duration maxAge = props.getRetrain().getResourceSampleMaxAge();
        if (u.sampledAt() != null && u.sampledAt().isBefore(clock.instant().minus(maxAge))) {
            return GovernorDecision.allow("resource sample older than " + maxAge + ", ignored");
        }

        LifecycleProperties.Resources limits = props.getResources();
        if (u.cpu() > limits.getCpuThreshold()) {
            return GovernorDecision.deny(String.format(Locale.ROOT, "cpu=%.2f > %.2f", u.cpu(), limits.getCpuThreshold()));
        }
        if (u.memory() > limits.getMemoryThreshold()) {
            return GovernorDecision.deny(String.format(Locale.ROOT, "memory=%.2f > %.2f", u.memory(), limits.getMemoryThreshold()));
        }
        if (u.disk() > limits.getDiskThreshold()) {
            return GovernorDecision.deny(String.format(Locale.ROOT, "disk=%.2f > %.2f", u.disk(), limits.getDiskThreshold()));
        }
        return GovernorDecision.allow("OK");
    }

    /**
     * Выполнить фазу с таймаутом. По таймауту задача прерывается и бросается {@link PhaseTimeoutException};
     * исключение самой фазы пробрасывается как есть (checked — в IllegalStateException).
     */
    public <T> T callWithin(String phase, Callable<T> task, Duration timeout) {
        Future<T> future = phaseExecutor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏱ PHASE {} timed out after {}", phase, timeout);
            throw new PhaseTimeoutException(phase, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException(phase + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException(phase + " interrupted", e);
        }
    }

    /**
     * Обучение под жёстким потолком. По таймауту вызывается cancelHook (отмена на стороне обучателя).
     */
    public TrainResult train(String attemptId, Callable<TrainedModel> fit, Duration ceiling, Runnable cancelHook) {
        Instant started = clock.instant();
        try {
            TrainedModel model = callWithin("training", fit, ceiling);
            if (model == null) {
                return TrainResult.failed(elapsedSince(started), "trainer returned no model");
            }
            return TrainResult.completed(model, elapsedSince(started));
        } catch (PhaseTimeoutException e) {
            try {
                cancelHook.run();
            } catch (RuntimeException ce) {
                log.warn("⚠️ attempt={} fit cancel failed: {}", attemptId, ce.getMessage());
            }
            return TrainResult.timedOut(elapsedSince(started), "training exceeded " + ceiling);
        } catch (RuntimeException e) {
            log.warn("⚠️ attempt={} fit failed: {}", attemptId, e.getMessage());
            return TrainResult.failed(elapsedSince(started), e.getMessage());
        }
    }

    private Duration elapsedSince(Instant started) {
        return Duration.between(started, clock.instant());
    }

    @PreDestroy
    public void shutdown() {
        phaseExecutor.shutdownNow();
    }
}
