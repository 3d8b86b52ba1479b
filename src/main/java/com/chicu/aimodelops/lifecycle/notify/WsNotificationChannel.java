package com.chicu.aimodelops.lifecycle.notify;

import com.chicu.aimodelops.config.LifecycleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 📡 Алерты в STOMP-топик (по умолчанию /topic/modelops/alerts).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsNotificationChannel implements NotificationChannel {

    private final SimpMessagingTemplate ws;
    private final LifecycleProperties props;

    @Override
    public String name() {
        return "ws";
    }

    @Override
    public boolean isEnabled() {
        return props.getNotify().isWsEnabled();
    }

    @Override
    public void deliver(AlertMessage alert) {
        String dest = props.getNotify().getWsTopic();
        log.debug("📡 WS SEND → {} severity={}", dest, alert.severity());
        ws.convertAndSend(dest, alert);
    }
}
