package com.chicu.aimodelops.lifecycle.store;

/**
 * model.json рядом с model.bin: что за модель и контрольная сумма байтов.
 */
public record ModelDescriptor(
        String modelKey,
        String schemaVersion,
        long sizeBytes,
        String sha256
) {}
