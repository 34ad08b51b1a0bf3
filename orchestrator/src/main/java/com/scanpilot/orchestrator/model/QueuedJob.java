package com.scanpilot.orchestrator.model;

import jakarta.persistence.*;

import java.util.UUID;

/**
 * Durable queue entry for a job waiting for a worker slot.
 *
 * The dispatcher claims the READY entry with the highest priority whose
 * {@code notBefore} has passed. A dispatch that fails before the job starts
 * is put back to READY with an exponentially growing {@code notBefore}.
 *
 * DB table: job_queue  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_queue")
public class QueuedJob {

    @Id
    @Column(name = "job_id")
    private UUID jobId;

    @Column(nullable = false)
    private int priority;

    // Epoch millis before which the entry must not be claimed.
    @Column(name = "not_before", nullable = false)
    private long notBefore;

    @Column(nullable = false)
    private int attempts = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QueueState state = QueueState.READY;

    @Column(name = "claimed_by")
    private String claimedBy;

    @Column(name = "claimed_at")
    private Long claimedAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "enqueued_at", nullable = false, updatable = false)
    private long enqueuedAt;

    protected QueuedJob() {}   // required by JPA

    public QueuedJob(UUID jobId, int priority, long notBefore, long enqueuedAt) {
        this.jobId      = jobId;
        this.priority   = priority;
        this.notBefore  = notBefore;
        this.enqueuedAt = enqueuedAt;
    }

    public UUID       getJobId()      { return jobId; }
    public int        getPriority()   { return priority; }
    public long       getNotBefore()  { return notBefore; }
    public int        getAttempts()   { return attempts; }
    public QueueState getState()      { return state; }
    public String     getClaimedBy()  { return claimedBy; }
    public Long       getClaimedAt()  { return claimedAt; }
    public String     getLastError()  { return lastError; }
    public long       getEnqueuedAt() { return enqueuedAt; }

    public void claim(String workerId, long now) {
        this.state     = QueueState.CLAIMED;
        this.claimedBy = workerId;
        this.claimedAt = now;
        this.attempts++;
    }

    public void release(long retryAt, String error) {
        this.state     = QueueState.READY;
        this.claimedBy = null;
        this.claimedAt = null;
        this.notBefore = retryAt;
        this.lastError = error;
    }

    public void bury(String error) {
        this.state     = QueueState.DEAD;
        this.claimedBy = null;
        this.lastError = error;
    }
}
