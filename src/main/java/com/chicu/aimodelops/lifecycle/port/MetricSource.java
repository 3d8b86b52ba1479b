package com.chicu.aimodelops.lifecycle.port;

import com.chicu.aimodelops.lifecycle.model.ResourceUsage;

import java.util.Map;

/**
 * Источник текущих сигналов о здоровье модели (pull).
 * Любой метод может бросить исключение — наблюдатель обработает это как сбой тика.
 */
public interface MetricSource {

    Map<String, Double> currentPerformance();

    double currentDriftScore();

    ResourceUsage currentResourceUsage();
}
