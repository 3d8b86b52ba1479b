package com.chicu.aimodelops.lifecycle.exception;

/**
 * Ошибка HTTP-вызова ML sidecar (сеть, не-2xx, пустой/битый ответ).
 */
public class SidecarException extends IllegalStateException {

    private final int httpCode;

    public SidecarException(String message, int httpCode) {
        super(message);
        this.httpCode = httpCode;
    }

    public SidecarException(String message, Throwable cause) {
        super(message, cause);
        this.httpCode = -1;
    }

    public int getHttpCode() {
        return httpCode;
    }
}
