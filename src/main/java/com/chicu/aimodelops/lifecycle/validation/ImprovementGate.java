package com.chicu.aimodelops.lifecycle.validation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Каждая отслеживаемая метрика должна вырасти не меньше чем на improvement-threshold (AND).
 * Для lower-is-better метрик улучшение = baseline - candidate.
 */
@Component
public class ImprovementGate implements ValidationGate {

    private static final double EPS = 1e-9;

    @Override
    public String name() {
        return "improvement";
    }

    @Override
    public int order() {
        return 10;
    }

    @Override
    public GateDecision evaluate(ValidationContext ctx) {
        if (ctx.getBaseline() == null) {
            return GateDecision.pass("no baseline");
        }

        ValidationPolicy policy = ctx.getPolicy();
        double threshold = policy.improvementThreshold();
        List<String> failed = new ArrayList<>();

        for (String metric : policy.trackedMetrics()) {
            Double candidate = ctx.candidateMetric(metric);
            if (candidate == null) {
                failed.add(metric + " missing in candidate");
                continue;
            }
            Double baseline = ctx.baselineMetric(metric);
            if (baseline == null) {
                // старая версия эту метрику не считала — сравнивать не с чем
                continue;
            }

            double delta = policy.isLowerBetter(metric) ? baseline - candidate : candidate - baseline;
            if (delta + EPS < threshold) {
                failed.add(String.format(Locale.ROOT, "%s delta=%.4f < %.4f", metric, delta, threshold));
            }
        }

        return failed.isEmpty() ? GateDecision.pass() : GateDecision.fail(String.join("; ", failed));
    }
}
