package com.scanpilot.orchestrator.service;

/** A submission is malformed. Raised before any state is created. */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
