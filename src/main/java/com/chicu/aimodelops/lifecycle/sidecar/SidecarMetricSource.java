package com.chicu.aimodelops.lifecycle.sidecar;

import com.chicu.aimodelops.lifecycle.drift.PsiCalculator;
import com.chicu.aimodelops.lifecycle.exception.SidecarException;
import com.chicu.aimodelops.lifecycle.model.ResourceUsage;
import com.chicu.aimodelops.lifecycle.port.MetricSource;
import com.chicu.aimodelops.lifecycle.sidecar.dto.DriftResponseDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.PerformanceResponseDto;
import com.chicu.aimodelops.lifecycle.sidecar.dto.ResourceUsageDto;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SidecarMetricSource implements MetricSource {

    private final MlSidecarClient client;
    private final Clock clock;

    @Override
    public Map<String, Double> currentPerformance() {
        PerformanceResponseDto resp = client.get("/metrics/performance", PerformanceResponseDto.class);
        if (resp.getMetrics() == null || resp.getMetrics().isEmpty()) {
            throw new SidecarException("ML sidecar: no performance metrics", 200);
        }
        return Map.copyOf(resp.getMetrics());
    }

    @Override
    public double currentDriftScore() {
        DriftResponseDto resp = client.get("/metrics/drift", DriftResponseDto.class);

        if (resp.getScore() != null) {
            return resp.getScore();
        }

        // score нет — считаем PSI по гистограммам
        if (resp.getReference() != null && resp.getCurrent() != null) {
            return PsiCalculator.psi(resp.getReference(), resp.getCurrent());
        }

        throw new SidecarException("ML sidecar: drift response has neither score nor distributions", 200);
    }

    @Override
    public ResourceUsage currentResourceUsage() {
        ResourceUsageDto resp = client.get("/metrics/resources", ResourceUsageDto.class);
        return new ResourceUsage(resp.getCpu(), resp.getMemory(), resp.getDisk(), clock.instant());
    }
}
