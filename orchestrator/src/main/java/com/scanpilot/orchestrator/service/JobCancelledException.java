package com.scanpilot.orchestrator.service;

import java.util.UUID;

/**
 * Unwinds a pipeline run once its job has been cancelled.
 * Control flow only: the CANCELLED state is already recorded when this is thrown.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(UUID jobId) {
        super("Job " + jobId + " was cancelled");
    }
}
