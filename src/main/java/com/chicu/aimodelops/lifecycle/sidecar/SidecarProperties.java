package com.chicu.aimodelops.lifecycle.sidecar;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "modelops.sidecar")
public class SidecarProperties {

    /**
     * Пример: http://127.0.0.1:8001
     */
    private String baseUrl = "http://127.0.0.1:8001";

    /**
     * Защита sidecar (если включена в python).
     */
    private String apiKey = "";

    private long connectTimeoutMs = 1000;
    private long readTimeoutMs = 8000;

    /**
     * Запас поверх бюджета обучения для read-timeout вызова /train.
     */
    private long trainTimeoutMarginMs = 30_000;
}
