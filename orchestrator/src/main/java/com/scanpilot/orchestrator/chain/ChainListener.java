package com.scanpilot.orchestrator.chain;

import com.scanpilot.orchestrator.model.LogLevel;

/**
 * Callback from a running chain back to the job that owns it.
 */
public interface ChainListener {

    ChainListener NONE = (level, message) -> {};

    /** Append a line to the job's log. */
    void log(LogLevel level, String message);

    /** True once the job has been cancelled; the chain should stop at the next tool boundary. */
    default boolean stopRequested() {
        return false;
    }
}
