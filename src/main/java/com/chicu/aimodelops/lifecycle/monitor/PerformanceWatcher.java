package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.common.enums.WatcherType;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.port.MetricSource;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Живая метрика качества ниже порога.
 */
@Component
public class PerformanceWatcher extends AbstractWatcher {

    private final MetricSource metrics;
    private final LifecycleProperties props;

    public PerformanceWatcher(MetricSource metrics, LifecycleProperties props, Clock clock) {
        super(WatcherType.PERFORMANCE, clock);
        this.metrics = metrics;
        this.props = props;
    }

    @Override
    protected Observation sample() {
        String metric = props.getTriggers().getPerformanceMetric();
        double threshold = props.getTriggers().getPerformanceThreshold();

        Map<String, Double> current = metrics.currentPerformance();
        Double value = current != null ? current.get(metric) : null;
        if (value == null || value.isNaN()) {
            throw new IllegalStateException("metric '" + metric + "' missing in performance snapshot");
        }

        if (value < threshold) {
            return Observation.breach(value, String.format(Locale.ROOT, "%s=%.4f < %.4f", metric, value, threshold));
        }
        return Observation.ok(value);
    }

    @Override
    protected RetrainReason reason() {
        return RetrainReason.PERFORMANCE_DEGRADATION;
    }

    @Override
    protected int requiredBreaches() {
        return props.getTriggers().getHysteresisN();
    }

    @Override
    public Duration interval() {
        return props.getMonitor().getPerformanceInterval();
    }
}
