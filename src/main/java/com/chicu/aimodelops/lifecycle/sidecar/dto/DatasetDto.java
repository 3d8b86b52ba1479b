package com.chicu.aimodelops.lifecycle.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetDto {

    private boolean ok;

    private String datasetId;
    private String split;
    private long rows;

    private String message;
}
