package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.AlertSeverity;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.WatcherState;
import com.chicu.aimodelops.lifecycle.port.Notifier;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Владелец наблюдателей: у каждого свой самоперепланирующийся тик.
 * Бизнес-логики здесь нет — только расписание, backoff и приём заявок в очередь.
 */
@Slf4j
@Service
public class MonitorSupervisor {

    private final List<Watcher> watchers;
    private final RetrainRequestQueue queue;
    private final Notifier notifier;
    private final LifecycleProperties props;

    private volatile ScheduledThreadPoolExecutor executor;
    private volatile boolean running;

    public MonitorSupervisor(List<Watcher> watchers,
                             RetrainRequestQueue queue,
                             Notifier notifier,
                             LifecycleProperties props) {
        this.watchers = List.copyOf(watchers);
        this.queue = queue;
        this.notifier = notifier;
        this.props = props;
    }

    // ==============================================================
    // ▶️ START
    // ==============================================================
    public synchronized void start() {
        if (running) {
            log.info("⏱ MonitorSupervisor already running");
            return;
        }

        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(
                Math.max(1, watchers.size()),
                r -> {
                    Thread t = new Thread(r);
                    t.setDaemon(true);
                    t.setName("watcher-" + t.getId());
                    return t;
                });
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        ex.setRemoveOnCancelPolicy(true);

        executor = ex;
        running = true;

        Duration initialDelay = props.getMonitor().getInitialDelay();
        for (Watcher w : watchers) {
            schedule(w, initialDelay);
            log.info("⏱ WATCHER {} scheduled (interval={}, initialDelay={})", w.type(), w.interval(), initialDelay);
        }
    }

    // ==============================================================
    // ⏹ STOP
    // ==============================================================

    /**
     * Новые тики не планируются, идущие проверки дорабатывают (до shutdown-grace).
     */
    @PreDestroy
    public void stop() {
        ScheduledThreadPoolExecutor ex;
        synchronized (this) {
            if (!running) return;
            running = false;
            ex = executor;
        }

        log.info("🛑 MonitorSupervisor stopping…");
        ex.shutdown();
        try {
            Duration grace = props.getMonitor().getShutdownGrace();
            if (!ex.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("⚠️ watchers did not finish within {}, forcing", grace);
                ex.shutdownNow();
            }
        } catch (InterruptedException e) {
            ex.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("🛑 MonitorSupervisor stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Приём заявки с учётом дедупликации по причине.
     */
    public boolean submit(RetrainRequest request) {
        return queue.offer(request);
    }

    public Map<String, WatcherState> states() {
        Map<String, WatcherState> out = new LinkedHashMap<>();
        for (Watcher w : watchers) {
            out.put(w.type().name(), w.state());
        }
        return out;
    }

    // ==============================================================
    // tick
    // ==============================================================

    void tick(Watcher watcher) {
        if (!running) return;

        try {
            Optional<RetrainRequest> request = watcher.check();
            request.ifPresent(this::submit);
        } catch (RuntimeException e) {
            log.error("❌ WATCHER {} tick crashed: {}", watcher.type(), e.getMessage(), e);
        }

        WatcherState st = watcher.state();
        int threshold = props.getMonitor().getFailureAlertThreshold();
        if (st.consecutiveFailures() > 0 && st.consecutiveFailures() == threshold) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("watcher", watcher.type().name());
            ctx.put("consecutiveFailures", st.consecutiveFailures());
            ctx.put("lastError", st.lastError());
            notifier.send(AlertSeverity.ERROR,
                    "Watcher " + watcher.type() + " failing for " + st.consecutiveFailures() + " consecutive checks", ctx);
        }

        Duration next = Backoff.nextDelay(watcher.interval(), st.consecutiveFailures(), props.getMonitor().getMaxBackoff());
        if (st.consecutiveFailures() > 0) {
            log.info("⏱ WATCHER {} backoff: next check in {}", watcher.type(), next);
        }
        schedule(watcher, next);
    }

    private void schedule(Watcher watcher, Duration delay) {
        ScheduledThreadPoolExecutor ex = executor;
        if (!running || ex == null || ex.isShutdown()) return;
        try {
            ex.schedule(() -> tick(watcher), Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("⏱ WATCHER {} not rescheduled: executor is shut down", watcher.type());
        }
    }
}
