package com.chicu.aimodelops.lifecycle.exception;

import java.time.Duration;

/**
 * Фаза попытки не уложилась в свой таймаут.
 */
public class PhaseTimeoutException extends RuntimeException {

    private final String phase;

    public PhaseTimeoutException(String phase, Duration timeout) {
        super("phase '" + phase + "' exceeded " + timeout);
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
