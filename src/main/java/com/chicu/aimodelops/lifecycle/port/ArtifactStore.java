package com.chicu.aimodelops.lifecycle.port;

import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;

import java.util.List;
import java.util.Optional;

/**
 * Долговременное хранилище артефактов моделей.
 * Все методы бросают {@link com.chicu.aimodelops.lifecycle.exception.ArtifactStoreException},
 * если хранилище недоступно.
 */
public interface ArtifactStore {

    /**
     * Пишет кандидата в staging, возвращает ссылку на него.
     */
    String write(String versionId, TrainedModel model);

    /**
     * Копирует артефакт по ссылке в версионный путь versionId, возвращает новую ссылку.
     */
    String copy(String artifactRef, String versionId);

    TrainedModel read(String artifactRef);

    void delete(String artifactRef);

    boolean exists(String artifactRef);

    /**
     * Ссылки на все версионные артефакты (staging не входит).
     */
    List<String> list();

    void saveMetadata(ModelVersion version);

    List<ModelVersion> loadMetadata();

    /**
     * Атомарно переключает указатель "current".
     */
    void swapCurrent(String versionId);

    Optional<String> readCurrent();

    /**
     * Убрать указатель (нет активной версии).
     */
    void clearCurrent();

    void clearStaging();
}
