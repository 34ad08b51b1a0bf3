package com.scanpilot.orchestrator.queue;

import com.scanpilot.orchestrator.model.QueuedJob;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable, priority-ordered queue of jobs waiting for a worker.
 *
 * Every method throws {@link QueueUnavailableException} when the backing
 * store cannot be used.
 */
public interface JobQueue {

    /** Add a job; it becomes claimable at {@code notBefore} (epoch millis). */
    void enqueue(UUID jobId, int priority, long notBefore);

    /** Atomically take the most urgent claimable entry, if any. */
    Optional<QueuedJob> claimNext(String workerId);

    /** The job ran; drop its entry. */
    void acknowledge(UUID jobId);

    /** Put a claimed entry back, claimable again at {@code retryAt}. */
    void retryLater(UUID jobId, String error, long retryAt);

    /** Give up on an entry; it stays visible as dead. */
    void bury(UUID jobId, String error);

    /** True if the job has an entry in any state. */
    boolean contains(UUID jobId);

    /** Drop an entry whatever its state. @return true if there was one */
    boolean remove(UUID jobId);

    /** Claimed entries not acknowledged since {@code cutoff}. */
    List<QueuedJob> staleClaims(long cutoff);

    QueueStats stats();
}
