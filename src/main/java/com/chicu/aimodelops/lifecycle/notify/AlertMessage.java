package com.chicu.aimodelops.lifecycle.notify;

import com.chicu.aimodelops.common.enums.AlertSeverity;

import java.time.Instant;
import java.util.Map;

public record AlertMessage(
        AlertSeverity severity,
        String message,
        Map<String, Object> context,
        Instant time
) {

    public AlertMessage {
        context = context == null ? Map.of() : context;
    }
}
