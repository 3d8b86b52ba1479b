package com.chicu.aimodelops.lifecycle.validation;

import com.chicu.aimodelops.lifecycle.model.Predictions;
import com.chicu.aimodelops.lifecycle.port.ModelTrainer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Кандидат k раз предсказывает один и тот же test set;
 * consistency = доля предсказаний повторных прогонов, совпавших с первым.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StabilityGate implements ValidationGate {

    private final ModelTrainer trainer;

    @Override
    public String name() {
        return "stability";
    }

    @Override
    public int order() {
        return 30;
    }

    @Override
    public GateDecision evaluate(ValidationContext ctx) {
        ValidationPolicy policy = ctx.getPolicy();
        int runs = Math.max(1, policy.stabilityRuns());

        List<Double> first = trainer.predict(ctx.getCandidate(), ctx.getTestSet()).values();
        if (first.isEmpty()) {
            ctx.report("stability.consistency", 0.0);
            return GateDecision.fail("candidate returned no predictions");
        }

        long matches = 0;
        long total = 0;
        for (int i = 1; i < runs; i++) {
            Predictions repeat = trainer.predict(ctx.getCandidate(), ctx.getTestSet());
            List<Double> values = repeat.values();
            for (int j = 0; j < first.size(); j++) {
                if (j < values.size() && Double.compare(first.get(j), values.get(j)) == 0) {
                    matches++;
                }
            }
            total += first.size();
        }

        double consistency = total == 0 ? 1.0 : (double) matches / total;
        ctx.report("stability.consistency", consistency);
        log.debug("🔬 stability runs={} consistency={}", runs, consistency);

        if (consistency >= policy.stabilityThreshold()) {
            return GateDecision.pass();
        }
        return GateDecision.fail(String.format(Locale.ROOT, "consistency=%.4f < %.4f over %d runs",
                consistency, policy.stabilityThreshold(), runs));
    }
}
