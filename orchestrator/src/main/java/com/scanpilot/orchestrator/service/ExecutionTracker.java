package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.model.ExecutionRecord;
import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.LogEntry;
import com.scanpilot.orchestrator.model.LogLevel;
import com.scanpilot.orchestrator.model.PipelineStage;
import com.scanpilot.orchestrator.persistence.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every state change of every job.
 *
 * <p>Holds a write-through cache of {@link ExecutionSnapshot}s. A change is
 * applied under the job's lock, written to the DB first, and only then
 * published to the cache, so the cache is never behind the DB and readers
 * always get a complete snapshot. Jobs not in the cache (finished, or left
 * over from a previous process) are rebuilt from the DB on demand.
 *
 * <p>Terminal snapshots are dropped from the cache once no worker holds the
 * job's {@link JobControl}.
 */
@Component
public class ExecutionTracker {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

    private static final int LOCK_STRIPES = 64;

    private final PersistenceGateway gateway;

    private final Map<UUID, ExecutionSnapshot> cache    = new ConcurrentHashMap<>();
    private final Map<UUID, JobControl>        controls = new ConcurrentHashMap<>();
    private final Object[]                     locks    = new Object[LOCK_STRIPES];

    public ExecutionTracker(PersistenceGateway gateway) {
        this.gateway = gateway;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** Cached snapshot if the job is live here, otherwise rebuilt from the DB. */
    public Optional<ExecutionSnapshot> snapshot(UUID jobId) {
        ExecutionSnapshot cached = cache.get(jobId);
        return cached != null ? Optional.of(cached) : load(jobId);
    }

    public Optional<ExecutionStatus> statusOf(UUID jobId) {
        return snapshot(jobId).map(ExecutionSnapshot::status);
    }

    /** True while the snapshot is held in memory. */
    public boolean isTracked(UUID jobId) {
        return cache.containsKey(jobId);
    }

    /** True while a worker in this process is running the job. */
    public boolean isAttached(UUID jobId) {
        return controls.containsKey(jobId);
    }

    /**
     * All persisted jobs, with live in-memory snapshots taking precedence. Newest first.
     * Jobs read from the DB carry only their newest {@code logLimit} log lines;
     * these snapshots are never cached.
     */
    public List<ExecutionSnapshot> all(int logLimit) {
        Map<UUID, ExecutionSnapshot> merged = new LinkedHashMap<>();
        for (ExecutionRecord r : gateway.findAllExecutions()) {
            List<LogLine> tail = gateway.recentLogs(r.getJobId(), logLimit).stream().map(LogLine::from).toList();
            merged.put(r.getJobId(), ExecutionSnapshot.from(r, gateway.decodeFindings(r.getFindings()), tail));
        }
        merged.putAll(cache);
        return merged.values().stream()
                .sorted(Comparator.comparingLong(ExecutionSnapshot::createdAt).reversed())
                .toList();
    }

    // ------------------------------------------------------------------
    // Lifecycle writes
    // ------------------------------------------------------------------

    /** Create the pending record for a freshly accepted job. */
    public ExecutionSnapshot register(UUID jobId, String taskId) {
        ExecutionSnapshot pending;
        synchronized (lockFor(jobId)) {
            pending = write(ExecutionSnapshot.pending(jobId, taskId, now()));
        }
        appendLog(jobId, LogLevel.INFO, "Task created");
        return pending;
    }

    /**
     * PENDING → RUNNING.
     *
     * @return false if the job is no longer pending; the caller must not run it
     */
    public boolean start(UUID jobId) {
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = current(jobId);
            if (s.status() != ExecutionStatus.PENDING) {
                log.info("Job {} is {} rather than pending, not starting it", jobId, s.status());
                evictIfDone(jobId);
                return false;
            }
            write(s.started(now()));
        }
        appendLog(jobId, LogLevel.INFO, "Task started");
        return true;
    }

    /**
     * Record that {@code stage} finished: progress, stage label and (if given)
     * findings land in one write, followed by a log line.
     *
     * @throws JobCancelledException if the job was cancelled meanwhile
     */
    public ExecutionSnapshot checkpoint(UUID jobId, PipelineStage stage, List<Finding> findings, String message) {
        ExecutionSnapshot next;
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = requireLive(jobId);
            next = s.atCheckpoint(stage);
            if (findings != null) {
                next = next.withFindings(findings);
            }
            write(next);
        }
        appendLog(jobId, LogLevel.INFO, message);
        return next;
    }

    /**
     * RUNNING → COMPLETED: progress 100, completion stamp, report reference.
     *
     * @return false if the job is paused; the worker must wait for resume and retry
     * @throws JobCancelledException if the job was cancelled meanwhile
     */
    public boolean complete(UUID jobId, String reportRef) {
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = requireLive(jobId);
            if (s.status() == ExecutionStatus.PAUSED) {
                return false;
            }
            write(s.completed(reportRef, now()));
        }
        appendLog(jobId, LogLevel.INFO, "Task completed");
        return true;
    }

    /** Any non-terminal state → FAILED. @return false if the job had already finished */
    public boolean fail(UUID jobId, String error) {
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = current(jobId);
            if (s.status().isTerminal()) {
                return false;
            }
            write(s.failed(error, now()));
        }
        appendLog(jobId, LogLevel.ERROR, "Task failed: " + error);
        return true;
    }

    /** PENDING → FAILED for a job whose dispatch was given up. @return false if it was not pending */
    public boolean failPending(UUID jobId, String error) {
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = current(jobId);
            if (s.status() != ExecutionStatus.PENDING) {
                return false;
            }
            write(s.failed(error, now()));
        }
        appendLog(jobId, LogLevel.ERROR, "Task failed: " + error);
        return true;
    }

    // ------------------------------------------------------------------
    // Operator control
    // ------------------------------------------------------------------

    /** @return false unless the job is live in memory and running */
    public boolean pause(UUID jobId) {
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = cache.get(jobId);
            JobControl control = controls.get(jobId);
            if (s == null || control == null || s.status() != ExecutionStatus.RUNNING) {
                return false;
            }
            write(s.withStatus(ExecutionStatus.PAUSED));
            control.pause();
        }
        appendLog(jobId, LogLevel.INFO, "Task paused");
        return true;
    }

    /** @return false unless the job is live in memory and paused */
    public boolean resume(UUID jobId) {
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = cache.get(jobId);
            JobControl control = controls.get(jobId);
            if (s == null || control == null || s.status() != ExecutionStatus.PAUSED) {
                return false;
            }
            write(s.withStatus(ExecutionStatus.RUNNING));
            control.resume();
        }
        appendLog(jobId, LogLevel.INFO, "Task resumed");
        return true;
    }

    /**
     * Pending, running or paused → CANCELLED. Wakes and stops the worker and
     * kills its child processes.
     *
     * @return false if the job had already finished
     * @throws JobNotFoundException if there is no such job
     */
    public boolean cancel(UUID jobId) {
        JobControl control;
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = current(jobId);
            if (!s.status().canTransitionTo(ExecutionStatus.CANCELLED)) {
                evictIfDone(jobId);
                return false;
            }
            write(s.cancelled(now()));
            control = controls.get(jobId);
        }
        appendLog(jobId, LogLevel.WARN, "Task cancelled");
        if (control != null) {
            control.cancel();
        }
        return true;
    }

    /**
     * Remove a finished job and its logs.
     *
     * @return false if the job is still pending or active
     * @throws JobNotFoundException if there is no such job
     */
    public boolean delete(UUID jobId) {
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = current(jobId);
            if (!s.status().isTerminal() || controls.containsKey(jobId)) {
                return false;
            }
            gateway.deleteJob(jobId);
            cache.remove(jobId);
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Logs
    // ------------------------------------------------------------------

    /** Append one job log line with the next sequence number. */
    public void appendLog(UUID jobId, LogLevel level, String message) {
        synchronized (lockFor(jobId)) {
            ExecutionSnapshot s = current(jobId);
            LogLine line = new LogLine(s.lastSequence() + 1, level, message, now());
            gateway.appendLog(new LogEntry(jobId, line.sequence(), level, message, line.timestamp()));
            cache.put(jobId, s.withLog(line));
            evictIfDone(jobId);
        }
    }

    // ------------------------------------------------------------------
    // Worker attachment
    // ------------------------------------------------------------------

    public JobControl attach(UUID jobId) {
        JobControl control = new JobControl(jobId);
        controls.put(jobId, control);
        return control;
    }

    public void detach(UUID jobId) {
        synchronized (lockFor(jobId)) {
            controls.remove(jobId);
            evictIfDone(jobId);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Object lockFor(UUID jobId) {
        return locks[Math.floorMod(jobId.hashCode(), LOCK_STRIPES)];
    }

    // Caller holds the job's lock.
    private ExecutionSnapshot current(UUID jobId) {
        ExecutionSnapshot s = cache.get(jobId);
        if (s == null) {
            s = load(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            cache.put(jobId, s);
        }
        return s;
    }

    // Caller holds the job's lock.
    private ExecutionSnapshot requireLive(UUID jobId) {
        ExecutionSnapshot s = current(jobId);
        if (s.status() == ExecutionStatus.CANCELLED) {
            throw new JobCancelledException(jobId);
        }
        if (s.status().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is already " + s.status().wireName());
        }
        return s;
    }

    // Caller holds the job's lock. DB first, then cache.
    private ExecutionSnapshot write(ExecutionSnapshot next) {
        ExecutionSnapshot prev = cache.get(next.jobId());
        if (prev != null && prev.status() != next.status() && !prev.status().canTransitionTo(next.status())) {
            throw new IllegalStateException("Job " + next.jobId() + " cannot move from "
                    + prev.status().wireName() + " to " + next.status().wireName());
        }
        gateway.saveExecution(next.toRecord(gateway.encodeFindings(next.findings())));
        cache.put(next.jobId(), next);
        return next;
    }

    private void evictIfDone(UUID jobId) {
        ExecutionSnapshot s = cache.get(jobId);
        if (s != null && s.status().isTerminal() && !controls.containsKey(jobId)) {
            cache.remove(jobId);
        }
    }

    private Optional<ExecutionSnapshot> load(UUID jobId) {
        return gateway.findExecution(jobId).map(this::fromRecord);
    }

    private ExecutionSnapshot fromRecord(ExecutionRecord r) {
        List<LogLine> logs = gateway.logs(r.getJobId()).stream().map(LogLine::from).toList();
        return ExecutionSnapshot.from(r, gateway.decodeFindings(r.getFindings()), logs);
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
