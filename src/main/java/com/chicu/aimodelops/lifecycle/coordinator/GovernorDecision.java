package com.chicu.aimodelops.lifecycle.coordinator;

import lombok.Builder;

@Builder
public record GovernorDecision(
        boolean allowed,
        String reason
) {
    public static GovernorDecision allow(String reason) {
        return GovernorDecision.builder().allowed(true).reason(reason).build();
    }

    public static GovernorDecision deny(String reason) {
        return GovernorDecision.builder().allowed(false).reason(reason).build();
    }
}
