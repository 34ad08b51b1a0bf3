package com.scanpilot.orchestrator.model;

import jakarta.persistence.*;

import java.util.UUID;

/**
 * Durable row for one job attempt.
 *
 * The orchestrator never edits this entity field by field: it builds an
 * immutable snapshot in memory and writes the whole row in one UPDATE, so
 * status, progress, stage and timestamps always land together.
 *
 * All timestamps are epoch millis.
 *
 * DB table: executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "executions")
public class ExecutionRecord {

    @Id
    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status;

    @Column(nullable = false)
    private int progress;

    @Column(name = "current_stage", nullable = false)
    private String currentStage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private long createdAt;

    @Column(name = "started_at")
    private Long startedAt;

    @Column(name = "completed_at")
    private Long completedAt;

    // JSON array of Finding objects.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String findings = "[]";

    // Artifact reference returned by report assembly.
    @Column(name = "report_ref")
    private String reportRef;

    @Column(columnDefinition = "TEXT")
    private String error;

    protected ExecutionRecord() {}   // required by JPA

    public ExecutionRecord(UUID jobId, String taskId, ExecutionStatus status, int progress,
                           String currentStage, long createdAt, Long startedAt, Long completedAt,
                           String findings, String reportRef, String error) {
        this.jobId        = jobId;
        this.taskId       = taskId;
        this.status       = status;
        this.progress     = progress;
        this.currentStage = currentStage;
        this.createdAt    = createdAt;
        this.startedAt    = startedAt;
        this.completedAt  = completedAt;
        this.findings     = findings;
        this.reportRef    = reportRef;
        this.error        = error;
    }

    public UUID            getJobId()        { return jobId; }
    public String          getTaskId()       { return taskId; }
    public ExecutionStatus getStatus()       { return status; }
    public int             getProgress()     { return progress; }
    public String          getCurrentStage() { return currentStage; }
    public long            getCreatedAt()    { return createdAt; }
    public Long            getStartedAt()    { return startedAt; }
    public Long            getCompletedAt()  { return completedAt; }
    public String          getFindings()     { return findings; }
    public String          getReportRef()    { return reportRef; }
    public String          getError()        { return error; }
}
