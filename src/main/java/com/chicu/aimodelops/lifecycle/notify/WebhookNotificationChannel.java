package com.chicu.aimodelops.lifecycle.notify;

import com.chicu.aimodelops.config.LifecycleProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON POST алерта на внешний webhook (Slack-прокси, PagerDuty и т.п.).
 * Выключен, пока modelops.notify.webhook-url пустой.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookNotificationChannel implements NotificationChannel {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final LifecycleProperties props;

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        String url = props.getNotify().getWebhookUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public void deliver(AlertMessage alert) throws IOException {
        String json = objectMapper.writeValueAsString(alert);

        Request req = new Request.Builder()
                .url(props.getNotify().getWebhookUrl().trim())
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response resp = httpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new IOException("webhook HTTP " + resp.code());
            }
        }
    }
}
