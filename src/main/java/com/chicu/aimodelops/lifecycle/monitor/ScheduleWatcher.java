package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.common.enums.WatcherType;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.version.VersionManager;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Плановое переобучение: активной версии больше retrain-interval.
 * Без активной версии заявка уходит сразу (первичное обучение).
 */
@Component
public class ScheduleWatcher extends AbstractWatcher {

    private final VersionManager versions;
    private final LifecycleProperties props;

    public ScheduleWatcher(VersionManager versions, LifecycleProperties props, Clock clock) {
        super(WatcherType.SCHEDULE, clock);
        this.versions = versions;
        this.props = props;
    }

    @Override
    protected Observation sample() {
        Duration interval = props.getTriggers().getRetrainInterval();
        Optional<ModelVersion> active = versions.current();

        if (active.isEmpty()) {
            return Observation.breach(0, "no active version, bootstrap training");
        }

        Duration age = Duration.between(active.get().createdAt(), clock.instant());
        double ageHours = age.toMinutes() / 60.0;

        if (age.compareTo(interval) >= 0) {
            return Observation.breach(ageHours,
                    String.format(Locale.ROOT, "version %s age=%.1fh >= %dh", active.get().id(), ageHours, interval.toHours()));
        }
        return Observation.ok(ageHours);
    }

    @Override
    protected RetrainReason reason() {
        return RetrainReason.SCHEDULED;
    }

    @Override
    protected int requiredBreaches() {
        return 1;
    }

    @Override
    public Duration interval() {
        return props.getMonitor().getScheduleInterval();
    }
}
