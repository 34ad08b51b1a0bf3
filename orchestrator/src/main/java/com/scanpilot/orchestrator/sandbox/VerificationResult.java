package com.scanpilot.orchestrator.sandbox;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one sandbox run.
 *
 * {@code confirmed} comes from {@link ConfirmationHeuristic}: a substring
 * match on stdout, not proof of exploitability.
 *
 * @param success          the code exited 0 within its timeout
 * @param reliabilityScore 80 confirmed, 20 ran but unconfirmed, 0 could not run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResult(
        boolean success,
        boolean confirmed,
        String  output,
        String  error,
        long    durationMs,
        int     reliabilityScore) {

    /** A run that never produced output. */
    public static VerificationResult error(String error, long durationMs) {
        return new VerificationResult(false, false, "", error, durationMs, ConfirmationHeuristic.ERROR_SCORE);
    }
}
