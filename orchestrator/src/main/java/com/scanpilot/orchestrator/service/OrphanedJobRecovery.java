package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.model.ExecutionRecord;
import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.LogLevel;
import com.scanpilot.orchestrator.model.TaskDefinition;
import com.scanpilot.orchestrator.persistence.PersistenceException;
import com.scanpilot.orchestrator.persistence.PersistenceGateway;
import com.scanpilot.orchestrator.queue.JobQueue;
import com.scanpilot.orchestrator.queue.QueueUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Startup sweep for jobs that a previous process owned without a queue entry,
 * i.e. jobs that went down the inline path.
 *
 * A pending job is handed back to the queue (or inline again if the queue is
 * still down). A running or paused job had its worker die with the process,
 * so it is failed. Jobs that still have a queue entry are left alone; the
 * dispatcher's stale-claim recovery owns those.
 *
 * Assumes one orchestrator node runs inline jobs against a given database.
 */
@Component
public class OrphanedJobRecovery implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(OrphanedJobRecovery.class);

    static final String WORKER_LOST = "Worker lost: orchestrator restarted while the job was running";

    private final PersistenceGateway gateway;
    private final ExecutionTracker   tracker;
    private final JobQueue           queue;
    private final JobDispatcher      dispatcher;

    public OrphanedJobRecovery(PersistenceGateway gateway,
                               ExecutionTracker tracker,
                               JobQueue queue,
                               JobDispatcher dispatcher) {
        this.gateway    = gateway;
        this.tracker    = tracker;
        this.queue      = queue;
        this.dispatcher = dispatcher;
    }

    @Override
    public void run(String... args) {
        recover();
    }

    /** @return how many jobs were requeued or failed */
    public int recover() {
        List<ExecutionRecord> open;
        try {
            open = gateway.findExecutionsByStatus(
                    EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING, ExecutionStatus.PAUSED));
        } catch (PersistenceException e) {
            log.error("Startup sweep skipped, could not list open jobs: {}", e.getMessage());
            return 0;
        }
        int handled = 0;
        for (ExecutionRecord r : open) {
            UUID jobId = r.getJobId();
            if (tracker.isAttached(jobId) || hasQueueEntry(jobId)) {
                continue;
            }
            try {
                if (r.getStatus() == ExecutionStatus.PENDING) {
                    redispatch(jobId, r.getTaskId());
                } else {
                    log.warn("Job {} was {} with no worker left, failing it", jobId, r.getStatus().wireName());
                    tracker.fail(jobId, WORKER_LOST);
                }
                handled++;
            } catch (RuntimeException e) {
                log.error("Could not recover job {}: {}", jobId, e.getMessage(), e);
            }
        }
        if (handled > 0) {
            log.info("Startup sweep recovered {} orphaned job(s)", handled);
        }
        return handled;
    }

    private void redispatch(UUID jobId, String taskId) {
        Optional<TaskDefinition> task = gateway.findTask(taskId);
        if (task.isEmpty()) {
            tracker.failPending(jobId, "Task " + taskId + " not found");
            return;
        }
        long now = System.currentTimeMillis();
        Long scheduledAt = task.get().getScheduledAt();
        long notBefore = scheduledAt == null ? now : Math.max(now, scheduledAt);
        try {
            queue.enqueue(jobId, task.get().getPriority(), notBefore);
            tracker.appendLog(jobId, LogLevel.WARN, "Requeued after restart");
        } catch (QueueUnavailableException e) {
            log.warn("Queue unavailable while requeueing job {}, running it inline: {}", jobId, e.getMessage());
            tracker.appendLog(jobId, LogLevel.WARN, "Rescheduled inline after restart");
            dispatcher.dispatchInline(jobId, notBefore - now);
        }
    }

    // Unknown counts as absent: with the queue down, the inline path is the only one left.
    private boolean hasQueueEntry(UUID jobId) {
        try {
            return queue.contains(jobId);
        } catch (QueueUnavailableException e) {
            return false;
        }
    }
}
