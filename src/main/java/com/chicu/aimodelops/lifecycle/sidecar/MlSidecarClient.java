package com.chicu.aimodelops.lifecycle.sidecar;

import com.chicu.aimodelops.lifecycle.exception.SidecarException;
import com.fasterxml.jackson.databind.JsonNode;
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
import java.time.Duration;

/**
 * HTTP/JSON клиент к python ML sidecar.
 * Через него ходят источник метрик, загрузчик данных и обучатель.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MlSidecarClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final SidecarProperties props;

    public JsonNode health() {
        return get("/health", JsonNode.class);
    }

    public <T> T get(String path, Class<T> responseType) {
        Request.Builder rb = new Request.Builder()
                .url(url(path))
                .get();
        return execute("GET", path, rb, responseType, Duration.ofMillis(props.getReadTimeoutMs()));
    }

    public <T> T post(String path, Object body, Class<T> responseType) {
        return post(path, body, responseType, Duration.ofMillis(props.getReadTimeoutMs()));
    }

    /**
     * POST с отдельным read-timeout (для долгих вызовов вроде /train).
     */
    public <T> T post(String path, Object body, Class<T> responseType, Duration readTimeout) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new SidecarException("ML sidecar: cannot serialize body for " + path + " -> " + e.getMessage(), e);
        }

        Request.Builder rb = new Request.Builder()
                .url(url(path))
                .post(RequestBody.create(json, JSON));

        return execute("POST", path, rb, responseType, readTimeout);
    }

    private <T> T execute(String method, String path, Request.Builder rb, Class<T> responseType, Duration readTimeout) {
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            rb.header("X-API-KEY", props.getApiKey().trim());
        }

        try (Response resp = clientWithTimeouts(readTimeout).newCall(rb.build()).execute()) {

            String respBody = resp.body() != null ? resp.body().string() : "";

            if (!resp.isSuccessful()) {
                log.warn("🧠 ML sidecar error: {} {} -> {} body={}", method, path, resp.code(), shrink(respBody));
                throw new SidecarException("ML sidecar HTTP " + resp.code() + ": " + shrink(respBody), resp.code());
            }

            if (respBody.isBlank()) {
                throw new SidecarException("ML sidecar empty response: " + path, resp.code());
            }

            return objectMapper.readValue(respBody, responseType);

        } catch (IOException e) {
            throw new SidecarException("ML sidecar IO error: " + method + " " + path + " -> " + e.getMessage(), e);
        }
    }

    private OkHttpClient clientWithTimeouts(Duration readTimeout) {
        long readMs = readTimeout != null ? readTimeout.toMillis() : props.getReadTimeoutMs();
        return baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, readMs)))
                .build();
    }

    private String url(String path) {
        return props.getBaseUrl().replaceAll("/+$", "") + path;
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
