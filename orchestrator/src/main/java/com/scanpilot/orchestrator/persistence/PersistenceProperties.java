package com.scanpilot.orchestrator.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry policy for gateway writes. Bound from {@code scanpilot.persistence.*}.
 */
@Component
@ConfigurationProperties(prefix = "scanpilot.persistence")
public class PersistenceProperties {

    private int  maxAttempts      = 3;
    private long initialBackoffMs = 200;

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public long getInitialBackoffMs() { return initialBackoffMs; }
    public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }
}
