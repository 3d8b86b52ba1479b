package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.AlertSeverity;
import com.chicu.aimodelops.common.enums.WatcherType;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.coordinator.ResourceGovernor;
import com.chicu.aimodelops.lifecycle.model.ResourceUsage;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.WatcherState;
import com.chicu.aimodelops.lifecycle.port.MetricSource;
import com.chicu.aimodelops.lifecycle.port.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Загрузка хоста. Заявок не выпускает: кормит {@link ResourceGovernor}
 * и шлёт WARNING при входе в перегрузку.
 */
@Slf4j
@Component
public class ResourceWatcher implements Watcher {

    private final MetricSource metrics;
    private final ResourceGovernor governor;
    private final Notifier notifier;
    private final LifecycleProperties props;
    private final Clock clock;

    private volatile WatcherState state = WatcherState.initial(WatcherType.RESOURCE);
    private volatile boolean overloaded;

    public ResourceWatcher(MetricSource metrics,
                           ResourceGovernor governor,
                           Notifier notifier,
                           LifecycleProperties props,
                           Clock clock) {
        this.metrics = metrics;
        this.governor = governor;
        this.notifier = notifier;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public WatcherType type() {
        return WatcherType.RESOURCE;
    }

    @Override
    public Duration interval() {
        return props.getMonitor().getResourceInterval();
    }

    @Override
    public WatcherState state() {
        return state;
    }

    @Override
    public Optional<RetrainRequest> check() {
        Instant now = clock.instant();

        ResourceUsage usage;
        try {
            usage = metrics.currentResourceUsage();
            if (usage == null) throw new IllegalStateException("resource usage = null");
        } catch (Exception e) {
            state = state.failed(now, e.getMessage());
            log.warn("⚠️ WATCHER RESOURCE sample failed (x{}): {}", state.consecutiveFailures(), e.getMessage());
            return Optional.empty();
        }

        governor.record(usage);

        LifecycleProperties.Resources limits = props.getResources();
        boolean breach = usage.cpu() > limits.getCpuThreshold()
                || usage.memory() > limits.getMemoryThreshold()
                || usage.disk() > limits.getDiskThreshold();

        double peak = Math.max(usage.cpu(), Math.max(usage.memory(), usage.disk()));
        state = state.observed(now, peak, breach ? state.consecutiveBreaches() + 1 : 0);

        if (breach && !overloaded) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("cpu", usage.cpu());
            ctx.put("memory", usage.memory());
            ctx.put("disk", usage.disk());
            notifier.send(AlertSeverity.WARNING, "Host resources above threshold", ctx);
        }
        if (!breach && overloaded) {
            log.info("✅ WATCHER RESOURCE back to normal cpu={} mem={} disk={}",
                    usage.cpu(), usage.memory(), usage.disk());
        }
        overloaded = breach;

        return Optional.empty();
    }
}
