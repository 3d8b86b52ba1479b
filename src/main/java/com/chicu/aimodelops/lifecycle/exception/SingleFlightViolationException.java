package com.chicu.aimodelops.lifecycle.exception;

/**
 * Обнаружены две одновременные попытки переобучения. Это дефект, а не рабочая ситуация.
 */
public class SingleFlightViolationException extends IllegalStateException {

    public SingleFlightViolationException(String message) {
        super(message);
    }
}
