package com.chicu.aimodelops.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Единая конфигурация контроллера жизненного цикла модели (prefix = modelops).
 * Все значения и допустимые диапазоны описаны в application.yml,
 * проверяются один раз при старте в {@link #validate()}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "modelops")
public class LifecycleProperties {

    private Monitor monitor = new Monitor();
    private Triggers triggers = new Triggers();
    private Retrain retrain = new Retrain();
    private Validation validation = new Validation();
    private Retention retention = new Retention();
    private Resources resources = new Resources();
    private Storage storage = new Storage();
    private Notify notify = new Notify();

    @Getter
    @Setter
    public static class Monitor {
        /** Запускать наблюдателей и координатор при старте приложения. */
        private boolean autoStart = true;
        private Duration initialDelay = Duration.ofSeconds(10);
        private Duration performanceInterval = Duration.ofMinutes(30);
        private Duration driftInterval = Duration.ofHours(1);
        private Duration scheduleInterval = Duration.ofHours(1);
        private Duration resourceInterval = Duration.ofMinutes(1);
        /** Потолок экспоненциального backoff после сбоев источника метрик. */
        private Duration maxBackoff = Duration.ofHours(2);
        /** Сколько сбоев подряд до алерта. */
        private int failureAlertThreshold = 5;
        private Duration shutdownGrace = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Triggers {
        private String performanceMetric = "accuracy";
        /** 0..1 */
        private double performanceThreshold = 0.75;
        /** 0..1 */
        private double driftThreshold = 0.2;
        private Duration retrainInterval = Duration.ofDays(7);
        /** Сколько пробитий подряд нужно до заявки. */
        private int hysteresisN = 2;
    }

    @Getter
    @Setter
    public static class Retrain {
        /** Жёсткий потолок на fit. */
        private Duration maxRetrainingTime = Duration.ofHours(2);
        private Duration fetchTimeout = Duration.ofMinutes(10);
        private Duration validationTimeout = Duration.ofMinutes(30);
        private Duration deployTimeout = Duration.ofMinutes(5);
        private int fetchFailureAlertThreshold = 3;
        /** Меньше строк в train / test — данные считаются непригодными. */
        private long minTrainingRows = 1;
        private long minTestRows = 1;
        /** Замер ресурсов старше этого не учитывается при проверке запаса. */
        private Duration resourceSampleMaxAge = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Validation {
        private List<String> trackedMetrics = new ArrayList<>(List.of("accuracy"));
        /** 0..1, абсолютная дельта candidate - baseline. */
        private double improvementThreshold = 0.01;
        private Map<String, Double> minimumRequirements = new LinkedHashMap<>(Map.of("accuracy", 0.7));
        /** 0..1 */
        private double stabilityThreshold = 0.95;
        private int stabilityRuns = 5;
        /** Версия схемы входа, которую ожидает serving. */
        private String expectedSchemaVersion = "1";
        /** Метрики, где меньше = лучше (rmse, log_loss ...). */
        private Set<String> lowerIsBetter = new LinkedHashSet<>();
    }

    @Getter
    @Setter
    public static class Retention {
        private int maxVersions = 5;
        private int retentionDays = 30;
        /** Автооткат свежей версии, если живая метрика упала ниже её валидированной больше чем на столько. 0..1 */
        private double rollbackThreshold = 0.05;
        /** Сколько после деплоя версия под наблюдением на автооткат. */
        private Duration probationWindow = Duration.ofHours(24);
        private boolean autoRollback = true;
    }

    @Getter
    @Setter
    public static class Resources {
        private double cpuThreshold = 0.9;
        private double memoryThreshold = 0.9;
        private double diskThreshold = 0.9;
    }

    @Getter
    @Setter
    public static class Storage {
        private String root = "./data/models";
    }

    @Getter
    @Setter
    public static class Notify {
        private boolean wsEnabled = true;
        private String wsTopic = "/topic/modelops/alerts";
        /** Пусто — webhook-канал выключен. */
        private String webhookUrl = "";
    }

    @PostConstruct
    public void validate() {
        List<String> errors = new ArrayList<>();

        positive(errors, "monitor.performance-interval", monitor.performanceInterval);
        positive(errors, "monitor.drift-interval", monitor.driftInterval);
        positive(errors, "monitor.schedule-interval", monitor.scheduleInterval);
        positive(errors, "monitor.resource-interval", monitor.resourceInterval);
        positive(errors, "monitor.max-backoff", monitor.maxBackoff);
        positive(errors, "monitor.shutdown-grace", monitor.shutdownGrace);
        if (monitor.initialDelay == null || monitor.initialDelay.isNegative()) {
            errors.add("monitor.initial-delay must be >= 0");
        }
        atLeastOne(errors, "monitor.failure-alert-threshold", monitor.failureAlertThreshold);

        if (triggers.performanceMetric == null || triggers.performanceMetric.isBlank()) {
            errors.add("triggers.performance-metric must not be blank");
        }
        unit(errors, "triggers.performance-threshold", triggers.performanceThreshold);
        unit(errors, "triggers.drift-threshold", triggers.driftThreshold);
        positive(errors, "triggers.retrain-interval", triggers.retrainInterval);
        atLeastOne(errors, "triggers.hysteresis-n", triggers.hysteresisN);

        positive(errors, "retrain.max-retraining-time", retrain.maxRetrainingTime);
        positive(errors, "retrain.fetch-timeout", retrain.fetchTimeout);
        positive(errors, "retrain.validation-timeout", retrain.validationTimeout);
        positive(errors, "retrain.deploy-timeout", retrain.deployTimeout);
        positive(errors, "retrain.resource-sample-max-age", retrain.resourceSampleMaxAge);
        atLeastOne(errors, "retrain.fetch-failure-alert-threshold", retrain.fetchFailureAlertThreshold);
        if (retrain.minTrainingRows < 1) errors.add("retrain.min-training-rows must be >= 1, got " + retrain.minTrainingRows);
        if (retrain.minTestRows < 1) errors.add("retrain.min-test-rows must be >= 1, got " + retrain.minTestRows);

        if (validation.trackedMetrics == null || validation.trackedMetrics.isEmpty()) {
            errors.add("validation.tracked-metrics must not be empty");
        }
        unit(errors, "validation.improvement-threshold", validation.improvementThreshold);
        unit(errors, "validation.stability-threshold", validation.stabilityThreshold);
        atLeastOne(errors, "validation.stability-runs", validation.stabilityRuns);
        if (validation.minimumRequirements != null) {
            validation.minimumRequirements.forEach((metric, floor) -> {
                if (floor == null || Double.isNaN(floor)) {
                    errors.add("validation.minimum-requirements." + metric + " must be a number");
                }
            });
        }
        if (validation.expectedSchemaVersion == null || validation.expectedSchemaVersion.isBlank()) {
            errors.add("validation.expected-schema-version must not be blank");
        }

        atLeastOne(errors, "retention.max-versions", retention.maxVersions);
        atLeastOne(errors, "retention.retention-days", retention.retentionDays);
        unit(errors, "retention.rollback-threshold", retention.rollbackThreshold);
        positive(errors, "retention.probation-window", retention.probationWindow);

        unit(errors, "resources.cpu-threshold", resources.cpuThreshold);
        unit(errors, "resources.memory-threshold", resources.memoryThreshold);
        unit(errors, "resources.disk-threshold", resources.diskThreshold);

        if (storage.root == null || storage.root.isBlank()) {
            errors.add("storage.root must not be blank");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid modelops configuration: " + String.join("; ", errors));
        }
    }

    private static void positive(List<String> errors, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            errors.add(name + " must be > 0");
        }
    }

    private static void unit(List<String> errors, String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            errors.add(name + " must be in [0..1], got " + value);
        }
    }

    private static void atLeastOne(List<String> errors, String name, int value) {
        if (value < 1) {
            errors.add(name + " must be >= 1, got " + value);
        }
    }
}
