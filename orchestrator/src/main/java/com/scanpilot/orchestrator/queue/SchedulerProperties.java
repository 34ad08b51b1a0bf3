package com.scanpilot.orchestrator.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Worker pool and durable queue settings, bound from {@code scanpilot.scheduler.*}.
 */
@Component
@ConfigurationProperties(prefix = "scanpilot.scheduler")
public class SchedulerProperties {

    // Parallel job slots shared by queued and inline dispatch.
    private int     workerCount       = 5;
    private long    pollDelayMs       = 2_000;
    // false forces every submission onto the inline path.
    private boolean queueEnabled      = true;
    private int     maxAttempts       = 3;
    private long    initialBackoffMs  = 2_000;
    private long    staleClaimMinutes = 30;

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public long getPollDelayMs() { return pollDelayMs; }
    public void setPollDelayMs(long pollDelayMs) { this.pollDelayMs = pollDelayMs; }

    public boolean isQueueEnabled() { return queueEnabled; }
    public void setQueueEnabled(boolean queueEnabled) { this.queueEnabled = queueEnabled; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public long getInitialBackoffMs() { return initialBackoffMs; }
    public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

    public long getStaleClaimMinutes() { return staleClaimMinutes; }
    public void setStaleClaimMinutes(long staleClaimMinutes) { this.staleClaimMinutes = staleClaimMinutes; }

    /** Delay before retry number {@code attempt} (1-based): initial, 2x, 4x ... */
    public long backoffFor(int attempt) {
        return initialBackoffMs * (1L << Math.max(0, Math.min(attempt - 1, 20)));
    }
}
