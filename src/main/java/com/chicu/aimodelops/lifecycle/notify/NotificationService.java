package com.chicu.aimodelops.lifecycle.notify;

import com.chicu.aimodelops.common.enums.AlertSeverity;
import com.chicu.aimodelops.lifecycle.port.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Рассылает алерт во все включённые каналы.
 * Сбой канала логируется и не мешает остальным (и тем более циклу переобучения).
 */
@Slf4j
@Service
public class NotificationService implements Notifier {

    private final List<NotificationChannel> channels;
    private final Clock clock;

    public NotificationService(List<NotificationChannel> channels, Clock clock) {
        this.channels = List.copyOf(channels);
        this.clock = clock;
        log.info("🔔 NotificationService: channels={}", channels.stream().map(NotificationChannel::name).toList());
    }

    @Override
    public void send(AlertSeverity severity, String message, Map<String, Object> context) {
        AlertSeverity sev = severity != null ? severity : AlertSeverity.INFO;
        Map<String, Object> ctx = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        AlertMessage alert = new AlertMessage(sev, message, ctx, clock.instant());

        for (NotificationChannel ch : channels) {
            if (!ch.isEnabled()) continue;
            try {
                ch.deliver(alert);
            } catch (Exception e) {
                log.warn("⚠️ notify channel '{}' failed: severity={} msg={} err={}",
                        ch.name(), sev, safe(message), e.getMessage());
            }
        }
    }

    private static String safe(String s) {
        if (s == null) return "";
        String x = s.trim();
        return x.length() > 200 ? x.substring(0, 200) : x;
    }
}
