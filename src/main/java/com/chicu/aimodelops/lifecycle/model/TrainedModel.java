package com.chicu.aimodelops.lifecycle.model;

/**
 * Непрозрачная обученная модель: содержимое нас не интересует,
 * только байты для хранения и версия схемы входа для проверки совместимости.
 */
public record TrainedModel(
        String modelKey,
        String schemaVersion,
        byte[] payload
) {

    public TrainedModel {
        payload = payload == null ? new byte[0] : payload;
    }
}
