package com.chicu.aimodelops.lifecycle.exception;

public class VersionNotFoundException extends RuntimeException {

    public VersionNotFoundException(String message) {
        super(message);
    }
}
