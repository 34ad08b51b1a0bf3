package com.scanpilot.orchestrator.api.dto;

import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.service.ExecutionSnapshot;

import java.util.List;
import java.util.UUID;

/**
 * Read-only view of one job returned by GET /api/tasks and GET /api/tasks/{jobId}.
 * Logs are the most recent lines only; GET /api/tasks/{jobId}/logs has all of them.
 */
public record TaskView(
        UUID              jobId,
        String            taskId,
        String            status,
        int               progress,
        String            currentStage,
        long              createdAt,
        Long              startedAt,
        Long              completedAt,
        List<Finding>     findings,
        List<LogLineView> logs,
        String            reportRef,
        String            error
) {
    public static TaskView from(ExecutionSnapshot s, int logLimit) {
        return new TaskView(
                s.jobId(),
                s.taskId(),
                s.status().wireName(),
                s.progress(),
                s.currentStage(),
                s.createdAt(),
                s.startedAt(),
                s.completedAt(),
                s.findings(),
                s.latestLogs(logLimit).stream().map(LogLineView::from).toList(),
                s.reportRef(),
                s.error()
        );
    }
}
