package com.chicu.aimodelops.lifecycle.model;

/**
 * Свежая пара train / held-out test.
 */
public record TrainingData(
        Dataset training,
        Dataset test
) {}
