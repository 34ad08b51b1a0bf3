package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.QueuedJob;
import com.scanpilot.orchestrator.queue.JobQueue;
import com.scanpilot.orchestrator.queue.QueueStats;
import com.scanpilot.orchestrator.queue.QueueUnavailableException;
import com.scanpilot.orchestrator.queue.SchedulerProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Feeds jobs to a fixed pool of worker threads.
 *
 * The durable queue is polled on a fixed delay; entries are claimed only
 * while a worker slot is free. Jobs dispatched inline (queue unavailable)
 * go to the same pool and count against the same slots.
 *
 * A queued run that throws while its job is still pending is put back
 * with exponential backoff, up to {@code max-attempts}; after that the job
 * is failed and the entry buried. Once a job has started, its own failure
 * handling is final and the entry is simply acknowledged.
 */
@Component
@EnableScheduling
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobQueue            queue;
    private final PipelineRunner      runner;
    private final ExecutionTracker    tracker;
    private final SchedulerProperties props;

    private final ExecutorService          workers;
    private final ScheduledExecutorService delays;

    // Jobs handed to the pool and not yet finished, from either path.
    private final AtomicInteger inFlight = new AtomicInteger();

    private final String nodeId = "node-" + UUID.randomUUID().toString().substring(0, 8);

    @Autowired
    public JobDispatcher(JobQueue queue, PipelineRunner runner, ExecutionTracker tracker, SchedulerProperties props) {
        this(queue, runner, tracker, props,
                Executors.newFixedThreadPool(props.getWorkerCount(), namedThreads("job-worker-")),
                Executors.newSingleThreadScheduledExecutor(namedThreads("job-delay-")));
    }

    JobDispatcher(JobQueue queue, PipelineRunner runner, ExecutionTracker tracker, SchedulerProperties props,
                  ExecutorService workers, ScheduledExecutorService delays) {
        this.queue   = queue;
        this.runner  = runner;
        this.tracker = tracker;
        this.props   = props;
        this.workers = workers;
        this.delays  = delays;
    }

    // ------------------------------------------------------------------
    // Queue path
    // ------------------------------------------------------------------

    /**
     * Claim ready entries until every worker slot is busy or the queue has
     * nothing claimable.
     */
    @Scheduled(fixedDelayString = "${scanpilot.scheduler.poll-delay-ms:2000}")
    public void tick() {
        if (!props.isQueueEnabled()) {
            return;
        }
        while (inFlight.get() < props.getWorkerCount()) {
            Optional<QueuedJob> claimed;
            try {
                claimed = queue.claimNext(nodeId);
            } catch (QueueUnavailableException e) {
                log.warn("Queue poll failed: {}", e.getMessage());
                return;
            }
            if (claimed.isEmpty()) {
                return;
            }
            QueuedJob entry = claimed.get();
            inFlight.incrementAndGet();
            workers.submit(() -> runQueued(entry));
        }
    }

    void runQueued(QueuedJob entry) {
        UUID jobId = entry.getJobId();
        try {
            runner.run(jobId);
            queue.acknowledge(jobId);
        } catch (Exception e) {
            handleFailure(entry, e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void handleFailure(QueuedJob entry, Exception cause) {
        UUID jobId = entry.getJobId();
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        try {
            Optional<ExecutionStatus> status = tracker.statusOf(jobId);
            if (status.isPresent() && status.get() == ExecutionStatus.PENDING) {
                if (entry.getAttempts() < props.getMaxAttempts()) {
                    long backoff = props.backoffFor(entry.getAttempts());
                    log.warn("Dispatch of job {} failed (attempt {}/{}), retrying in {} ms: {}",
                            jobId, entry.getAttempts(), props.getMaxAttempts(), backoff, reason);
                    queue.retryLater(jobId, reason, System.currentTimeMillis() + backoff);
                } else {
                    log.error("Dispatch of job {} failed {} times, giving up: {}",
                            jobId, entry.getAttempts(), reason);
                    tracker.failPending(jobId, "Dispatch failed after " + entry.getAttempts() + " attempts: " + reason);
                    queue.bury(jobId, reason);
                }
            } else {
                queue.acknowledge(jobId);
            }
        } catch (RuntimeException e) {
            log.error("Could not settle queue entry for job {} after failure '{}': {}",
                    jobId, reason, e.getMessage(), e);
        }
    }

    /**
     * Requeue entries whose claim is older than {@code stale-claim-minutes}
     * and whose job never started. A job that started but is no longer
     * running anywhere in this process is failed.
     */
    @Scheduled(fixedDelay = 60_000)
    public void recoverStalledClaims() {
        if (!props.isQueueEnabled()) {
            return;
        }
        long now = System.currentTimeMillis();
        List<QueuedJob> stale;
        try {
            stale = queue.staleClaims(now - TimeUnit.MINUTES.toMillis(props.getStaleClaimMinutes()));
        } catch (QueueUnavailableException e) {
            log.warn("Stale claim scan failed: {}", e.getMessage());
            return;
        }
        for (QueuedJob entry : stale) {
            UUID jobId = entry.getJobId();
            if (tracker.isAttached(jobId)) {
                continue;   // still running here
            }
            try {
                ExecutionStatus status = tracker.statusOf(jobId).orElse(null);
                if (status == ExecutionStatus.PENDING) {
                    log.warn("Requeueing job {} claimed by '{}' at {}", jobId, entry.getClaimedBy(), entry.getClaimedAt());
                    queue.retryLater(jobId, "Claim expired", now);
                } else {
                    if (status != null && status.isActive()) {
                        tracker.fail(jobId, "Worker lost");
                    }
                    queue.acknowledge(jobId);
                }
            } catch (RuntimeException e) {
                log.error("Could not recover stale claim for job {}: {}", jobId, e.getMessage(), e);
            }
        }
    }

    // ------------------------------------------------------------------
    // Inline path
    // ------------------------------------------------------------------

    /**
     * Run a job on the worker pool without going through the queue.
     * A job that cannot even start is failed; there is no retry.
     */
    public void dispatchInline(UUID jobId, long delayMs) {
        Runnable submit = () -> {
            inFlight.incrementAndGet();
            workers.submit(() -> runInline(jobId));
        };
        if (delayMs > 0) {
            log.info("Job {} scheduled inline in {} ms", jobId, delayMs);
            delays.schedule(submit, delayMs, TimeUnit.MILLISECONDS);
        } else {
            submit.run();
        }
    }

    void runInline(UUID jobId) {
        try {
            runner.run(jobId);
        } catch (Exception e) {
            log.error("Inline run of job {} failed: {}", jobId, e.getMessage());
            try {
                tracker.failPending(jobId, "Dispatch failed: " + e.getMessage());
            } catch (RuntimeException inner) {
                log.error("Could not mark job {} failed: {}", jobId, inner.getMessage());
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public int activeWorkers() {
        return inFlight.get();
    }

    public QueueStats stats() {
        QueueStats counts;
        try {
            counts = queue.stats();
        } catch (QueueUnavailableException e) {
            counts = QueueStats.unavailable();
        }
        return counts.withWorkers(inFlight.get(), props.getWorkerCount());
    }

    @PreDestroy
    public void shutdown() {
        delays.shutdownNow();
        workers.shutdown();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> new Thread(r, prefix + seq.incrementAndGet());
    }
}
