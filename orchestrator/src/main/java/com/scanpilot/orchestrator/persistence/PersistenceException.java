package com.scanpilot.orchestrator.persistence;

/**
 * Thrown when a gateway operation still fails after its retry budget.
 *
 * Unchecked: callers either fail the job or log and move on, they never
 * retry again themselves.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
