package com.chicu.aimodelops.runtime;

import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.coordinator.RetrainCoordinator;
import com.chicu.aimodelops.lifecycle.monitor.MonitorSupervisor;
import com.chicu.aimodelops.lifecycle.version.VersionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Старт контура после поднятия контекста: координатор раньше наблюдателей,
 * чтобы первая заявка уже имела потребителя.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LifecycleBootstrap implements ApplicationRunner {

    private final LifecycleProperties props;
    private final VersionManager versionManager;
    private final RetrainCoordinator coordinator;
    private final MonitorSupervisor supervisor;

    @Override
    public void run(ApplicationArguments args) {
        log.info("🗂 active version on start: {}",
                versionManager.current().map(v -> v.id()).orElse("none"));

        if (!props.getMonitor().isAutoStart()) {
            log.info("⏸ modelops.monitor.auto-start=false, lifecycle loop not started");
            return;
        }

        coordinator.start();
        supervisor.start();
        log.info("▶️ model lifecycle loop started");
    }
}
