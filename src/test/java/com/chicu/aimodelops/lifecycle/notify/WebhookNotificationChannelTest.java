package com.chicu.aimodelops.lifecycle.notify;

import com.chicu.aimodelops.common.enums.AlertSeverity;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebhookNotificationChannelTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private MockWebServer server;
    private LifecycleProperties props;
    private WebhookNotificationChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        props = new LifecycleProperties();
        props.getNotify().setWebhookUrl(server.url("/hook").toString());
        channel = new WebhookNotificationChannel(new OkHttpClient(), objectMapper, props);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void disabledWithoutUrl() {
        props.getNotify().setWebhookUrl(" ");
        assertFalse(channel.isEnabled());
    }

    @Test
    void postsAlertAsJson() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        channel.deliver(new AlertMessage(AlertSeverity.WARNING, "Candidate v000003 rejected",
                Map.of("attemptId", "a-7"), Instant.parse("2024-05-01T10:00:00Z")));

        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(req);
        assertEquals("POST", req.getMethod());
        assertEquals("/hook", req.getPath());

        JsonNode body = objectMapper.readTree(req.getBody().readUtf8());
        assertEquals("WARNING", body.get("severity").asText());
        assertEquals("Candidate v000003 rejected", body.get("message").asText());
        assertEquals("a-7", body.get("context").get("attemptId").asText());
    }

    @Test
    void non2xx_throws() {
        server.enqueue(new MockResponse().setResponseCode(500));

        AlertMessage alert = new AlertMessage(AlertSeverity.ERROR, "x", Map.of(), Instant.now());
        IOException e = assertThrows(IOException.class, () -> channel.deliver(alert));
        assertTrue(e.getMessage().contains("500"));
    }
}
