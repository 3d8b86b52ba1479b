package com.chicu.aimodelops.lifecycle.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Тело /predict и /evaluate: модель + ссылка на датасет.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelCallRequestDto {

    private String modelKey;
    private byte[] model;
    private String datasetId;
}
