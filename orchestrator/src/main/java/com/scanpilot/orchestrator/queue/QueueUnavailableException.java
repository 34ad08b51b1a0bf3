package com.scanpilot.orchestrator.queue;

/**
 * The durable queue cannot be reached or is switched off.
 * Submission falls back to inline dispatch when it sees this.
 */
public class QueueUnavailableException extends RuntimeException {

    public QueueUnavailableException(String message) {
        super(message);
    }

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
