package com.chicu.aimodelops.lifecycle.model;

import java.util.List;

public record Predictions(List<Double> values) {

    public Predictions {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public int size() {
        return values.size();
    }
}
