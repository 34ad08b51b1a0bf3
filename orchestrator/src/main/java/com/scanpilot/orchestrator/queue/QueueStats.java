package com.scanpilot.orchestrator.queue;

/**
 * Point-in-time queue and worker counts.
 *
 * @param ready   READY entries whose start time has passed
 * @param delayed READY entries still waiting for a schedule or a retry backoff
 * @param claimed entries a worker is currently running
 * @param dead    entries that exhausted their dispatch attempts
 */
public record QueueStats(
        boolean available,
        long    ready,
        long    delayed,
        long    claimed,
        long    dead,
        int     activeWorkers,
        int     workerCount) {

    public static QueueStats unavailable() {
        return new QueueStats(false, 0, 0, 0, 0, 0, 0);
    }

    public QueueStats withWorkers(int active, int total) {
        return new QueueStats(available, ready, delayed, claimed, dead, active, total);
    }
}
