package com.chicu.aimodelops.lifecycle.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sidecar отдаёт либо готовый score, либо гистограммы (доли по бинам),
 * тогда PSI считаем сами.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftResponseDto {

    private Double score;

    private double[] reference;
    private double[] current;
}
