package com.chicu.aimodelops.lifecycle.validation;

import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Версия схемы входа кандидата = ожидаемая serving-окружением.
 */
@Component
public class CompatibilityGate implements ValidationGate {

    @Override
    public String name() {
        return "compatibility";
    }

    @Override
    public int order() {
        return 40;
    }

    @Override
    public GateDecision evaluate(ValidationContext ctx) {
        String expected = ctx.getPolicy().expectedSchemaVersion();
        if (expected == null || expected.isBlank()) {
            return GateDecision.pass("no expected schema configured");
        }

        String actual = ctx.getCandidate().schemaVersion();
        if (Objects.equals(expected, actual)) {
            return GateDecision.pass();
        }
        return GateDecision.fail("schema " + actual + " != expected " + expected);
    }
}
