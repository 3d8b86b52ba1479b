package com.chicu.aimodelops.lifecycle.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainResponseDto {

    private boolean ok;

    private String modelKey;
    private String schemaVersion;

    // base64 в JSON
    private byte[] model;

    private String message;
}
