package com.chicu.aimodelops.lifecycle.sidecar;

import com.chicu.aimodelops.lifecycle.exception.DataUnavailableException;
import com.chicu.aimodelops.lifecycle.exception.SidecarException;
import com.chicu.aimodelops.lifecycle.model.Dataset;
import com.chicu.aimodelops.lifecycle.port.TrainingDataLoader;
import com.chicu.aimodelops.lifecycle.sidecar.dto.DatasetDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.LoadDataRequestDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SidecarDataLoader implements TrainingDataLoader {

    static final String TRAIN = "train";
    static final String TEST = "test";

    private final MlSidecarClient client;

    @Override
    public Dataset loadTrainingData() {
        return load(TRAIN);
    }

    @Override
    public Dataset loadTestData() {
        return load(TEST);
    }

    private Dataset load(String split) {
        DatasetDto resp;
        try {
            resp = client.post("/data/load", LoadDataRequestDto.builder().split(split).build(), DatasetDto.class);
        } catch (SidecarException e) {
            throw new DataUnavailableException("dataset '" + split + "' unavailable: " + e.getMessage(), e);
        }

        if (resp == null || !resp.isOk() || resp.getDatasetId() == null || resp.getDatasetId().isBlank()) {
            String msg = resp != null ? resp.getMessage() : "null response";
            throw new DataUnavailableException("dataset '" + split + "' unavailable: " + msg);
        }
        if (resp.getRows() <= 0) {
            throw new DataUnavailableException("dataset '" + split + "' is empty (datasetId=" + resp.getDatasetId() + ")");
        }

        log.info("📦 DATA LOADED split={} datasetId={} rows={}", split, resp.getDatasetId(), resp.getRows());
        return new Dataset(resp.getDatasetId(), split, resp.getRows());
    }
}
