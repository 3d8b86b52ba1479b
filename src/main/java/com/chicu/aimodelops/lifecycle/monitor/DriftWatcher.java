package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.DriftSeverity;
import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.common.enums.WatcherType;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.port.MetricSource;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Дрейф входных данных выше порога. Серьёзность пишется в detail заявки.
 */
@Component
public class DriftWatcher extends AbstractWatcher {

    private final MetricSource metrics;
    private final LifecycleProperties props;

    public DriftWatcher(MetricSource metrics, LifecycleProperties props, Clock clock) {
        super(WatcherType.DRIFT, clock);
        this.metrics = metrics;
        this.props = props;
    }

    @Override
    protected Observation sample() {
        double threshold = props.getTriggers().getDriftThreshold();
        double score = metrics.currentDriftScore();
        if (Double.isNaN(score)) {
            throw new IllegalStateException("drift score is NaN");
        }

        if (score > threshold) {
            DriftSeverity severity = DriftSeverity.of(score, threshold);
            return Observation.breach(score,
                    String.format(Locale.ROOT, "drift=%.4f > %.4f severity=%s", score, threshold, severity));
        }
        return Observation.ok(score);
    }

    @Override
    protected RetrainReason reason() {
        return RetrainReason.DATA_DRIFT;
    }

    @Override
    protected int requiredBreaches() {
        return props.getTriggers().getHysteresisN();
    }

    @Override
    public Duration interval() {
        return props.getMonitor().getDriftInterval();
    }
}
