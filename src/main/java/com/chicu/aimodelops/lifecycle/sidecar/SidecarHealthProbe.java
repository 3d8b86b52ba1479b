package com.chicu.aimodelops.lifecycle.sidecar;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SidecarHealthProbe implements ApplicationRunner {

    private final MlSidecarClient client;

    @Override
    public void run(ApplicationArguments args) {
        try {
            var node = client.health();
            log.info("✅ ML sidecar OK: {}", node.toString());
        } catch (Exception e) {
            // Не валим приложение: наблюдатели сами уйдут в backoff.
            log.warn("⚠️ ML sidecar NOT available: {}", e.getMessage());
        }
    }
}
