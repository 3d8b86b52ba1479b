package com.chicu.aimodelops.runtime;

import com.chicu.aimodelops.lifecycle.model.LifecycleStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * /actuator/health → modelLifecycle. DOWN: координатор остановлен инвариантом
 * или неудачный откат ждёт человека.
 */
@Component("modelLifecycle")
@RequiredArgsConstructor
public class LifecycleHealthIndicator implements HealthIndicator {

    private final LifecycleStatus status;

    @Override
    public Health health() {
        Health.Builder b = (status.isHalted() || status.isRequiresIntervention()) ? Health.down() : Health.up();
        return b.withDetail("state", status.getState().name())
                .withDetail("retraining", status.isRetraining())
                .withDetail("currentVersion", status.getCurrentVersionId() != null ? status.getCurrentVersionId() : "none")
                .withDetail("requiresIntervention", status.isRequiresIntervention())
                .build();
    }
}
