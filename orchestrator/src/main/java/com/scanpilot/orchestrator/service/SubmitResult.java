package com.scanpilot.orchestrator.service;

import java.util.UUID;

/**
 * @param queued false if the queue was unavailable and the job was dispatched inline
 */
public record SubmitResult(String taskId, UUID jobId, boolean queued) {}
