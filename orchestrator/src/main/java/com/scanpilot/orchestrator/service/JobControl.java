package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.process.ProcessRunner;
import com.scanpilot.orchestrator.process.ProcessTracker;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pause/resume/cancel handle shared between the API thread and the worker
 * running a job.
 *
 * The worker calls {@link #awaitBoundary()} between stages: it blocks while
 * the job is paused and throws once it is cancelled. Child processes started
 * for the job are registered here so cancellation can kill them at once.
 */
public class JobControl implements ProcessTracker {

    private final UUID         jobId;
    private final Object       monitor   = new Object();
    private final Set<Process> processes = ConcurrentHashMap.newKeySet();

    private boolean paused;
    private volatile boolean cancelled;

    public JobControl(UUID jobId) {
        this.jobId = jobId;
    }

    public void pause() {
        synchronized (monitor) {
            paused = true;
        }
    }

    public void resume() {
        synchronized (monitor) {
            paused = false;
            monitor.notifyAll();
        }
    }

    /** Flag the job cancelled, wake a paused worker and kill running children. */
    public void cancel() {
        synchronized (monitor) {
            cancelled = true;
            monitor.notifyAll();
        }
        processes.forEach(ProcessRunner::destroyTree);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isPaused() {
        synchronized (monitor) {
            return paused;
        }
    }

    /**
     * Stage boundary: wait while paused.
     *
     * @throws JobCancelledException if the job is, or becomes, cancelled
     */
    public void awaitBoundary() {
        synchronized (monitor) {
            while (paused && !cancelled) {
                try {
                    monitor.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new JobCancelledException(jobId);
                }
            }
        }
        throwIfCancelled();
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new JobCancelledException(jobId);
        }
    }

    // ------------------------------------------------------------------
    // ProcessTracker
    // ------------------------------------------------------------------

    @Override
    public void track(Process process) {
        processes.add(process);
        if (cancelled) {
            ProcessRunner.destroyTree(process);
        }
    }

    @Override
    public void untrack(Process process) {
        processes.remove(process);
    }
}
