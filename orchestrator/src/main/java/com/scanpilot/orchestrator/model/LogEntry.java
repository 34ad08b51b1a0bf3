package com.scanpilot.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.util.UUID;

/**
 * One append-only job log line.
 *
 * Ordered by {@code sequence} within a job. Written only by the orchestrator
 * and its collaborators; removed only when the whole job is deleted.
 *
 * DB table: logs  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "logs")
public class LogEntry {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(nullable = false)
    private long sequence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LogLevel level;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "ts", nullable = false)
    private long timestamp;

    protected LogEntry() {}   // required by JPA

    public LogEntry(UUID jobId, long sequence, LogLevel level, String message, long timestamp) {
        this.id        = UUID.randomUUID();
        this.jobId     = jobId;
        this.sequence  = sequence;
        this.level     = level;
        this.message   = message;
        this.timestamp = timestamp;
    }

    public UUID     getId()        { return id; }
    public UUID     getJobId()     { return jobId; }
    public long     getSequence()  { return sequence; }
    public LogLevel getLevel()     { return level; }
    public String   getMessage()   { return message; }
    public long     getTimestamp() { return timestamp; }
}
