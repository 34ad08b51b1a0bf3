package com.scanpilot.orchestrator.chain;

/** The chain reported {@code success=false}. Fails the job. */
public class ChainExecutionException extends RuntimeException {

    public ChainExecutionException(String message) {
        super(message);
    }
}
