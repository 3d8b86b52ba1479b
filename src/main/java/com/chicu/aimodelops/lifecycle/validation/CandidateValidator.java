package com.chicu.aimodelops.lifecycle.validation;

import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.model.Dataset;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import com.chicu.aimodelops.lifecycle.model.ValidatorReport;
import com.chicu.aimodelops.lifecycle.port.ArtifactStore;
import com.chicu.aimodelops.lifecycle.port.ModelTrainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Прогоняет кандидата через гейты: improvement → minimum_requirements → stability → compatibility.
 * Принят только если прошли все; при отказе остальные гейты не запускаются,
 * но уже посчитанные метрики в отчёт попадают.
 * Baseline переоценивается на том же тестовом наборе, что и кандидат.
 */
@Slf4j
@Service
public class CandidateValidator {

    private final ModelTrainer trainer;
    private final ArtifactStore store;
    private final List<ValidationGate> gates;
    private final LifecycleProperties props;

    public CandidateValidator(ModelTrainer trainer,
                              ArtifactStore store,
                              List<ValidationGate> gates,
                              LifecycleProperties props) {
        this.trainer = trainer;
        this.store = store;
        this.gates = gates.stream().sorted(Comparator.comparingInt(ValidationGate::order)).toList();
        this.props = props;
    }

    public ValidatorReport validate(TrainedModel candidate, ModelVersion baseline, Dataset testSet) {
        return validate(candidate, baseline, testSet, ValidationPolicy.from(props.getValidation()));
    }

    public ValidatorReport validate(TrainedModel candidate,
                                    ModelVersion baseline,
                                    Dataset testSet,
                                    ValidationPolicy policy) {

        Map<String, Double> candidateMetrics = trainer.evaluate(candidate, testSet);
        Map<String, Double> baselineMetrics = Map.of();
        boolean rescored = false;
        if (baseline != null) {
            Map<String, Double> fresh = rescoreBaseline(baseline, testSet);
            rescored = fresh != null;
            baselineMetrics = rescored ? fresh : (baseline.metrics() != null ? baseline.metrics() : Map.of());
        }

        ValidationContext ctx = new ValidationContext(candidate, candidateMetrics, baseline, baselineMetrics, testSet, policy);

        ctx.getCandidateMetrics().forEach((k, v) -> ctx.report("candidate." + k, v));
        if (baseline != null) {
            ctx.getBaselineMetrics().forEach((k, v) -> ctx.report("baseline." + k, v));
            ctx.report("baseline.rescored", rescored ? 1.0 : 0.0);
            for (String metric : policy.trackedMetrics()) {
                Double c = ctx.candidateMetric(metric);
                Double b = ctx.baselineMetric(metric);
                if (c != null && b != null) {
                    ctx.report("delta." + metric, policy.isLowerBetter(metric) ? b - c : c - b);
                }
            }
        }

        for (ValidationGate gate : gates) {
            GateDecision decision = gate.evaluate(ctx);
            if (!decision.passed()) {
                String reason = gate.failureCode() + ": " + decision.reason();
                log.warn("🚫 CANDIDATE REJECTED gate={} baseline={} {}",
                        gate.name(), baseline != null ? baseline.id() : "none", decision.reason());
                return ValidatorReport.builder()
                        .accepted(false)
                        .failedGate(gate.name())
                        .reasons(List.of(reason))
                        .metrics(ctx.getReportMetrics())
                        .build();
            }
            log.debug("✅ gate {} passed ({})", gate.name(), decision.reason());
        }

        log.info("✅ CANDIDATE ACCEPTED baseline={} metrics={}",
                baseline != null ? baseline.id() : "none", ctx.getReportMetrics());
        return ValidatorReport.builder()
                .accepted(true)
                .reasons(List.of())
                .metrics(ctx.getReportMetrics())
                .build();
    }

    /**
     * @return метрики baseline на testSet; null — артефакт не прочитать или оценка упала,
     * тогда сравниваем с метриками, сохранёнными при его валидации
     */
    private Map<String, Double> rescoreBaseline(ModelVersion baseline, Dataset testSet) {
        try {
            TrainedModel model = store.read(baseline.artifactRef());
            Map<String, Double> fresh = trainer.evaluate(model, testSet);
            if (fresh == null || fresh.isEmpty()) {
                log.warn("⚠️ baseline {} evaluate returned no metrics, using stored {}", baseline.id(), baseline.metrics());
                return null;
            }
            log.info("📏 baseline {} rescored on {}: {} (stored {})",
                    baseline.id(), testSet.datasetId(), fresh, baseline.metrics());
            return fresh;
        } catch (RuntimeException e) {
            log.warn("⚠️ baseline {} not rescored ({}), using stored {}",
                    baseline.id(), e.getMessage(), baseline.metrics());
            return null;
        }
    }
}
