package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.model.ExecutionRecord;
import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.PipelineStage;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable view of one job: its execution record plus findings and log lines.
 *
 * Every change produces a new snapshot, so a reader holding one never sees
 * a half-applied update. Progress never moves backwards.
 */
public record ExecutionSnapshot(
        UUID            jobId,
        String          taskId,
        ExecutionStatus status,
        int             progress,
        String          currentStage,
        long            createdAt,
        Long            startedAt,
        Long            completedAt,
        List<Finding>   findings,
        List<LogLine>   logs,
        String          reportRef,
        String          error) {

    public ExecutionSnapshot {
        findings = List.copyOf(findings);
        logs     = List.copyOf(logs);
    }

    public static ExecutionSnapshot pending(UUID jobId, String taskId, long now) {
        return new ExecutionSnapshot(jobId, taskId, ExecutionStatus.PENDING, 0, PipelineStage.ACCEPTED_LABEL,
                now, null, null, List.of(), List.of(), null, null);
    }

    public static ExecutionSnapshot from(ExecutionRecord r, List<Finding> findings, List<LogLine> logs) {
        return new ExecutionSnapshot(r.getJobId(), r.getTaskId(), r.getStatus(), r.getProgress(),
                r.getCurrentStage(), r.getCreatedAt(), r.getStartedAt(), r.getCompletedAt(),
                findings, logs, r.getReportRef(), r.getError());
    }

    public ExecutionRecord toRecord(String findingsJson) {
        return new ExecutionRecord(jobId, taskId, status, progress, currentStage, createdAt,
                startedAt, completedAt, findingsJson, reportRef, error);
    }

    // ------------------------------------------------------------------
    // Derived
    // ------------------------------------------------------------------

    public long lastSequence() {
        return logs.isEmpty() ? 0 : logs.get(logs.size() - 1).sequence();
    }

    /** The newest {@code limit} log lines, oldest first. */
    public List<LogLine> latestLogs(int limit) {
        return logs.size() <= limit ? logs : logs.subList(logs.size() - limit, logs.size());
    }

    // ------------------------------------------------------------------
    // Withers
    // ------------------------------------------------------------------

    public ExecutionSnapshot started(long now) {
        return new ExecutionSnapshot(jobId, taskId, ExecutionStatus.RUNNING, progress, PipelineStage.STARTING_LABEL,
                createdAt, startedAt == null ? now : startedAt, completedAt, findings, logs, reportRef, error);
    }

    public ExecutionSnapshot withStatus(ExecutionStatus next) {
        return new ExecutionSnapshot(jobId, taskId, next, progress, currentStage,
                createdAt, startedAt, completedAt, findings, logs, reportRef, error);
    }

    public ExecutionSnapshot atCheckpoint(PipelineStage stage) {
        return new ExecutionSnapshot(jobId, taskId, status, Math.max(progress, stage.checkpoint()), stage.nextLabel(),
                createdAt, startedAt, completedAt, findings, logs, reportRef, error);
    }

    public ExecutionSnapshot withFindings(List<Finding> next) {
        return new ExecutionSnapshot(jobId, taskId, status, progress, currentStage,
                createdAt, startedAt, completedAt, next, logs, reportRef, error);
    }

    public ExecutionSnapshot withLog(LogLine line) {
        List<LogLine> next = new ArrayList<>(logs.size() + 1);
        next.addAll(logs);
        next.add(line);
        return new ExecutionSnapshot(jobId, taskId, status, progress, currentStage,
                createdAt, startedAt, completedAt, findings, next, reportRef, error);
    }

    public ExecutionSnapshot completed(String report, long now) {
        return new ExecutionSnapshot(jobId, taskId, ExecutionStatus.COMPLETED,
                Math.max(progress, PipelineStage.REPORT_ASSEMBLY.checkpoint()),
                PipelineStage.REPORT_ASSEMBLY.nextLabel(),
                createdAt, startedAt, completedAt == null ? now : completedAt, findings, logs, report, error);
    }

    public ExecutionSnapshot failed(String message, long now) {
        return new ExecutionSnapshot(jobId, taskId, ExecutionStatus.FAILED, progress, "failed",
                createdAt, startedAt, completedAt == null ? now : completedAt, findings, logs, reportRef, message);
    }

    public ExecutionSnapshot cancelled(long now) {
        return new ExecutionSnapshot(jobId, taskId, ExecutionStatus.CANCELLED, progress, "cancelled",
                createdAt, startedAt, completedAt == null ? now : completedAt, findings, logs, reportRef, error);
    }
}
