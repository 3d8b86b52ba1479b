package com.chicu.aimodelops.lifecycle.port;

import com.chicu.aimodelops.lifecycle.model.Dataset;
import com.chicu.aimodelops.lifecycle.model.Predictions;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;

import java.time.Duration;
import java.util.Map;

/**
 * Внешний "обучатель". Алгоритм внутри нас не касается.
 */
public interface ModelTrainer {

    TrainedModel fit(String attemptId, Dataset dataset, Duration timeBudget);

    Predictions predict(TrainedModel model, Dataset dataset);

    Map<String, Double> evaluate(TrainedModel model, Dataset dataset);

    /**
     * Прервать fit попытки attemptId (вызывается по таймауту).
     */
    void cancel(String attemptId);
}
