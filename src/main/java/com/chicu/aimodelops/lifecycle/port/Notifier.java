package com.chicu.aimodelops.lifecycle.port;

import com.chicu.aimodelops.common.enums.AlertSeverity;

import java.util.Map;

/**
 * Best-effort доставка алертов. Реализация не должна бросать исключения наружу.
 */
public interface Notifier {

    void send(AlertSeverity severity, String message, Map<String, Object> context);
}
