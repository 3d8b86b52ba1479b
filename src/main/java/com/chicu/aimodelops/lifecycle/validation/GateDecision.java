package com.chicu.aimodelops.lifecycle.validation;

import lombok.Builder;

@Builder
public record GateDecision(
        boolean passed,
        String reason
) {
    public static GateDecision pass() {
        return GateDecision.builder().passed(true).reason("OK").build();
    }

    public static GateDecision pass(String note) {
        return GateDecision.builder().passed(true).reason(note).build();
    }

    public static GateDecision fail(String reason) {
        return GateDecision.builder().passed(false).reason(reason).build();
    }
}
