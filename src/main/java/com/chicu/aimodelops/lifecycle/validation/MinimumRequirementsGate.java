package com.chicu.aimodelops.lifecycle.validation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Абсолютный порог по каждой метрике, независимо от baseline.
 * Для lower-is-better порог работает как потолок.
 */
@Component
public class MinimumRequirementsGate implements ValidationGate {

    @Override
    public String name() {
        return "minimum_requirements";
    }

    @Override
    public int order() {
        return 20;
    }

    @Override
    public GateDecision evaluate(ValidationContext ctx) {
        ValidationPolicy policy = ctx.getPolicy();
        List<String> failed = new ArrayList<>();

        for (Map.Entry<String, Double> req : policy.minimumRequirements().entrySet()) {
            String metric = req.getKey();
            double bound = req.getValue();
            Double value = ctx.candidateMetric(metric);

            if (value == null) {
                failed.add(metric + " missing in candidate");
            } else if (policy.isLowerBetter(metric) ? value > bound : value < bound) {
                failed.add(String.format(Locale.ROOT, "%s=%.4f %s %.4f",
                        metric, value, policy.isLowerBetter(metric) ? ">" : "<", bound));
            }
        }

        return failed.isEmpty() ? GateDecision.pass() : GateDecision.fail(String.join("; ", failed));
    }
}
