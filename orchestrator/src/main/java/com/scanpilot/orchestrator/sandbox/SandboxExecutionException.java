package com.scanpilot.orchestrator.sandbox;

/**
 * The sandbox could not prepare or start a verification run
 * (directory or file I/O, missing interpreter, interruption).
 *
 * A run that starts and then fails or times out is not an exception; it is
 * reported through {@link VerificationResult}.
 */
public class SandboxExecutionException extends RuntimeException {

    public SandboxExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
