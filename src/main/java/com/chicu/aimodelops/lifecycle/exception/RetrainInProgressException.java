package com.chicu.aimodelops.lifecycle.exception;

public class RetrainInProgressException extends IllegalStateException {

    public RetrainInProgressException(String message) {
        super(message);
    }
}
