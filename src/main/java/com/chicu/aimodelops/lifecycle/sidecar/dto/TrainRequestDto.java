package com.chicu.aimodelops.lifecycle.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainRequestDto {

    private String attemptId;
    private String datasetId;
    private long timeBudgetSeconds;

    @Builder.Default
    private Map<String, Object> meta = Map.of();
}
