package com.chicu.aimodelops.lifecycle.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LogNotificationChannel implements NotificationChannel {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void deliver(AlertMessage alert) {
        switch (alert.severity()) {
            case CRITICAL, ERROR -> log.error("🚨 ALERT [{}] {} ctx={}", alert.severity(), alert.message(), alert.context());
            case WARNING -> log.warn("⚠️ ALERT [{}] {} ctx={}", alert.severity(), alert.message(), alert.context());
            default -> log.info("🔔 ALERT [{}] {} ctx={}", alert.severity(), alert.message(), alert.context());
        }
    }
}
