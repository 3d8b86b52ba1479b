package com.chicu.aimodelops.lifecycle.sidecar;

import com.chicu.aimodelops.lifecycle.exception.SidecarException;
import com.chicu.aimodelops.lifecycle.model.Dataset;
import com.chicu.aimodelops.lifecycle.model.Predictions;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import com.chicu.aimodelops.lifecycle.port.ModelTrainer;
import com.chicu.aimodelops.lifecycle.sidecar.dto.AckDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.CancelRequestDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.EvaluateResponseDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.ModelCallRequestDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.PredictResponseDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.TrainRequestDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.TrainResponseDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SidecarModelTrainer implements ModelTrainer {

    private final MlSidecarClient client;
    private final SidecarProperties props;

    @Override
    public TrainedModel fit(String attemptId, Dataset dataset, Duration timeBudget) {
        if (dataset == null) throw new IllegalArgumentException("dataset=null");

        TrainRequestDto req = TrainRequestDto.builder()
                .attemptId(attemptId)
                .datasetId(dataset.datasetId())
                .timeBudgetSeconds(Math.max(1, timeBudget.toSeconds()))
                .meta(Map.of("rows", dataset.rows()))
                .build();

        Duration readTimeout = timeBudget.plusMillis(props.getTrainTimeoutMarginMs());
        TrainResponseDto resp = client.post("/train", req, TrainResponseDto.class, readTimeout);

        if (resp == null || !resp.isOk()) {
            log.warn("🧠 TRAIN FAIL attempt={} resp={}", attemptId, resp);
            throw new IllegalStateException("training failed: " + (resp != null ? resp.getMessage() : "null response"));
        }

        log.info("🧠 TRAIN OK attempt={} modelKey={} schema={} bytes={}",
                attemptId, resp.getModelKey(), resp.getSchemaVersion(),
                resp.getModel() != null ? resp.getModel().length : 0);

        return new TrainedModel(resp.getModelKey(), resp.getSchemaVersion(), resp.getModel());
    }

    @Override
    public Predictions predict(TrainedModel model, Dataset dataset) {
        PredictResponseDto resp = client.post("/predict", callBody(model, dataset), PredictResponseDto.class);
        if (resp == null || !resp.isOk()) {
            throw new IllegalStateException("predict failed: " + (resp != null ? resp.getMessage() : "null response"));
        }
        return new Predictions(resp.getPredictions());
    }

    @Override
    public Map<String, Double> evaluate(TrainedModel model, Dataset dataset) {
        EvaluateResponseDto resp = client.post("/evaluate", callBody(model, dataset), EvaluateResponseDto.class);
        if (resp == null || !resp.isOk()) {
            throw new IllegalStateException("evaluate failed: " + (resp != null ? resp.getMessage() : "null response"));
        }
        Map<String, Double> metrics = resp.getMetrics();
        if (metrics == null || metrics.isEmpty()) {
            throw new SidecarException("ML sidecar: evaluate returned no metrics for " + dataset.datasetId(), 200);
        }
        if (metrics.values().stream().anyMatch(v -> v == null || v.isNaN())) {
            throw new SidecarException("ML sidecar: evaluate returned incomplete metrics " + metrics, 200);
        }
        return Map.copyOf(metrics);
    }

    @Override
    public void cancel(String attemptId) {
        AckDto ack = client.post("/train/cancel", CancelRequestDto.builder().attemptId(attemptId).build(), AckDto.class);
        log.info("🛑 TRAIN CANCEL attempt={} ok={} msg={}", attemptId, ack != null && ack.isOk(), ack != null ? ack.getMessage() : "");
    }

    private static ModelCallRequestDto callBody(TrainedModel model, Dataset dataset) {
        return ModelCallRequestDto.builder()
                .modelKey(model.modelKey())
                .model(model.payload())
                .datasetId(dataset.datasetId())
                .build();
    }
}
