package com.scanpilot.orchestrator.process;

/**
 * Receives every child process for the lifetime of its run so that an
 * owner (typically a job's control handle) can destroy it early.
 */
public interface ProcessTracker {

    ProcessTracker NONE = new ProcessTracker() {
        @Override public void track(Process process)   {}
        @Override public void untrack(Process process) {}
    };

    void track(Process process);

    void untrack(Process process);
}
