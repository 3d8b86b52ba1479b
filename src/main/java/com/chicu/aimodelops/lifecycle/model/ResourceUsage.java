package com.chicu.aimodelops.lifecycle.model;

import java.time.Instant;

/**
 * Доли загрузки 0..1.
 */
public record ResourceUsage(
        double cpu,
        double memory,
        double disk,
        Instant sampledAt
) {}
