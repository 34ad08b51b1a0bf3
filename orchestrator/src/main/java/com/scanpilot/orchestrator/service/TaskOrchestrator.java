package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.model.LogLevel;
import com.scanpilot.orchestrator.model.ModelSelection;
import com.scanpilot.orchestrator.model.Priority;
import com.scanpilot.orchestrator.model.Strategy;
import com.scanpilot.orchestrator.model.TaskDefinition;
import com.scanpilot.orchestrator.persistence.PersistenceGateway;
import com.scanpilot.orchestrator.queue.JobQueue;
import com.scanpilot.orchestrator.queue.QueueStats;
import com.scanpilot.orchestrator.queue.QueueUnavailableException;
import com.scanpilot.orchestrator.tool.ArgumentPolicy;
import com.scanpilot.orchestrator.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Public face of the job lifecycle: submission, operator control and status.
 *
 * The pipeline itself runs in {@link PipelineRunner}; every state change
 * goes through {@link ExecutionTracker}.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private static final String ANONYMOUS = "anonymous";

    private final PersistenceGateway gateway;
    private final ExecutionTracker   tracker;
    private final JobQueue           queue;
    private final JobDispatcher      dispatcher;
    private final ToolRegistry       tools;

    public TaskOrchestrator(PersistenceGateway gateway,
                            ExecutionTracker tracker,
                            JobQueue queue,
                            JobDispatcher dispatcher,
                            ToolRegistry tools) {
        this.gateway    = gateway;
        this.tracker    = tracker;
        this.queue      = queue;
        this.dispatcher = dispatcher;
        this.tools      = tools;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Accept a task and queue its first job.
     *
     * Order of writes: task definition, pending execution record plus its
     * first log line, queue entry. If the queue is unavailable the job is
     * dispatched inline on the worker pool instead; the pending record is
     * not written again.
     *
     * @throws ValidationException if the submission is malformed; nothing is written
     */
    public SubmitResult submit(TaskSubmission s) {
        TaskDefinition task = validate(s);
        UUID jobId = UUID.randomUUID();

        gateway.saveTask(task);
        tracker.register(jobId, task.getId());
        log.info("Accepted task {} as job {} (target={}, tools={}, priority={})",
                task.getId(), jobId, task.getTarget(), task.getTools(), task.getPriority());

        long now = System.currentTimeMillis();
        long notBefore = task.getScheduledAt() != null ? Math.max(now, task.getScheduledAt()) : now;
        try {
            queue.enqueue(jobId, task.getPriority(), notBefore);
            return new SubmitResult(task.getId(), jobId, true);
        } catch (QueueUnavailableException e) {
            log.warn("Queue unavailable for job {}, dispatching inline: {}", jobId, e.getMessage());
            tracker.appendLog(jobId, LogLevel.WARN, "Queue unavailable, running on the local worker pool");
            dispatcher.dispatchInline(jobId, notBefore - now);
            return new SubmitResult(task.getId(), jobId, false);
        }
    }

    // ------------------------------------------------------------------
    // Operator control
    // ------------------------------------------------------------------

    /** @return false if the job is not running in this process */
    public boolean pause(UUID jobId) {
        return tracker.pause(jobId);
    }

    /** @return false if the job is not paused in this process */
    public boolean resume(UUID jobId) {
        return tracker.resume(jobId);
    }

    /**
     * @return false if the job had already finished
     * @throws JobNotFoundException if there is no such job
     */
    public boolean cancel(UUID jobId) {
        boolean cancelled = tracker.cancel(jobId);
        if (cancelled) {
            try {
                queue.remove(jobId);
            } catch (QueueUnavailableException e) {
                // The dispatcher will find the job cancelled and acknowledge the entry.
                log.warn("Could not remove job {} from the queue: {}", jobId, e.getMessage());
            }
        }
        return cancelled;
    }

    /**
     * Remove a finished job's record and logs.
     *
     * @return false if the job has not finished
     * @throws JobNotFoundException if there is no such job
     */
    public boolean delete(UUID jobId) {
        boolean deleted = tracker.delete(jobId);
        if (deleted) {
            log.info("Deleted job {}", jobId);
        }
        return deleted;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<ExecutionSnapshot> getStatus(UUID jobId) {
        return tracker.snapshot(jobId);
    }

    /** Every known job, newest first, each with at most {@code logLimit} recent log lines loaded. */
    public List<ExecutionSnapshot> listAll(int logLimit) {
        return tracker.all(logLimit);
    }

    public Optional<List<LogLine>> logs(UUID jobId) {
        return tracker.snapshot(jobId).map(ExecutionSnapshot::logs);
    }

    public Optional<TaskDefinition> task(String taskId) {
        return gateway.findTask(taskId);
    }

    public QueueStats queueStats() {
        return dispatcher.stats();
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    private TaskDefinition validate(TaskSubmission s) {
        if (s == null) {
            throw new ValidationException("Submission is empty");
        }
        requireText(s.name(), "name");
        requireText(s.target(), "target");
        requireText(s.model(), "model");
        if (!ArgumentPolicy.isSafeTarget(s.target().trim())) {
            throw new ValidationException("Target contains characters that are not allowed: " + s.target());
        }

        ModelSelection selection;
        Strategy strategy;
        try {
            selection = ModelSelection.of(s.provider(), s.model().trim());
            strategy  = Strategy.fromWire(s.strategy());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }

        List<String> toolNames = s.tools() == null ? List.of() : List.copyOf(s.tools());
        for (String tool : toolNames) {
            if (!tools.contains(tool)) {
                throw new ValidationException("Unknown tool: " + tool);
            }
        }

        int depth = s.depth() != null ? s.depth() : strategy.defaultDepth();
        if (depth < 1) {
            throw new ValidationException("Depth must be at least 1");
        }
        String target = s.target().trim();
        List<String> scope = s.scope() == null || s.scope().isEmpty() ? List.of(target) : s.scope();

        return new TaskDefinition(
                "task_" + UUID.randomUUID(),
                s.name().trim(),
                target,
                selection,
                toolNames,
                strategy,
                depth,
                scope,
                s.excludeRules() == null ? List.of() : s.excludeRules(),
                s.userId() == null || s.userId().isBlank() ? ANONYMOUS : s.userId(),
                Priority.fromWire(s.priority()).weight(),
                s.scheduledAt(),
                s.verify() == null || s.verify(),
                System.currentTimeMillis());
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field: " + field);
        }
    }
}
