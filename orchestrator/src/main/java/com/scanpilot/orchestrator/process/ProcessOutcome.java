package com.scanpilot.orchestrator.process;

/**
 * Result of one child process run.
 *
 * @param exitCode   process exit status, or -1 when it was killed on timeout
 * @param truncated  true if either stream exceeded the capture cap
 */
public record ProcessOutcome(
        int     exitCode,
        String  stdout,
        String  stderr,
        boolean timedOut,
        boolean truncated,
        long    durationMs) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
