package com.scanpilot.orchestrator.api.dto;

import java.util.UUID;

/** Response body for POST /api/tasks. Poll GET /api/tasks/{jobId} for progress. */
public record SubmitTaskResponse(boolean success, String taskId, UUID jobId, String message) {}
