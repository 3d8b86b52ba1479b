package com.chicu.aimodelops.lifecycle.model;

import com.chicu.aimodelops.common.enums.WatcherType;

import java.time.Instant;

/**
 * Память наблюдателя между тиками. Меняется только своим наблюдателем.
 */
public record WatcherState(
        WatcherType type,
        Instant lastCheckAt,
        Double lastValue,
        int consecutiveBreaches,
        int consecutiveFailures,
        String lastError
) {

    public static WatcherState initial(WatcherType type) {
        return new WatcherState(type, null, null, 0, 0, null);
    }

    public WatcherState observed(Instant at, double value, int breaches) {
        return new WatcherState(type, at, value, breaches, 0, null);
    }

    public WatcherState failed(Instant at, String error) {
        return new WatcherState(type, at, lastValue, consecutiveBreaches, consecutiveFailures + 1, error);
    }
}
