package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.common.enums.WatcherType;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.WatcherState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Общий тик: замер → гистерезис → (может быть) заявка.
 * Счётчик пробитий сбрасывается после выпуска заявки и при первом нормальном замере.
 */
@Slf4j
public abstract class AbstractWatcher implements Watcher {

    protected final Clock clock;
    private volatile WatcherState state;

    protected AbstractWatcher(WatcherType type, Clock clock) {
        this.clock = clock;
        this.state = WatcherState.initial(type);
    }

    protected abstract Observation sample() throws Exception;

    protected abstract RetrainReason reason();

    /**
     * Сколько пробитий подряд нужно до заявки.
     */
    protected abstract int requiredBreaches();

    @Override
    public WatcherType type() {
        return state.type();
    }

    @Override
    public WatcherState state() {
        return state;
    }

    @Override
    public final Optional<RetrainRequest> check() {
        Instant now = clock.instant();

        Observation obs;
        try {
            obs = sample();
        } catch (Exception e) {
            state = state.failed(now, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.warn("⚠️ WATCHER {} sample failed (x{}): {}", type(), state.consecutiveFailures(), e.getMessage());
            return Optional.empty();
        }

        if (!obs.breached()) {
            state = state.observed(now, obs.value(), 0);
            return Optional.empty();
        }

        int breaches = state.consecutiveBreaches() + 1;
        if (breaches < Math.max(1, requiredBreaches())) {
            state = state.observed(now, obs.value(), breaches);
            log.info("👀 WATCHER {} breach {}/{} value={} {}",
                    type(), breaches, requiredBreaches(), obs.value(), nullToEmpty(obs.detail()));
            return Optional.empty();
        }

        state = state.observed(now, obs.value(), 0);
        log.warn("🚨 WATCHER {} TRIGGER value={} {}", type(), obs.value(), nullToEmpty(obs.detail()));
        return Optional.of(RetrainRequest.of(reason(), now, obs.detail()));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
