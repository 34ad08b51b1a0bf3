package com.scanpilot.orchestrator.sandbox;

/**
 * Decides whether verification output indicates the issue is real.
 *
 * A heuristic: stdout is searched for the language's indicator tokens
 * (see {@link SandboxLanguage#indicators()}). The score is deliberately
 * coarse.
 */
public final class ConfirmationHeuristic {

    public static final int CONFIRMED_SCORE   = 80;
    public static final int UNCONFIRMED_SCORE = 20;
    public static final int ERROR_SCORE       = 0;

    private ConfirmationHeuristic() {}

    public static boolean confirmed(SandboxLanguage language, String stdout) {
        if (stdout == null || stdout.isEmpty()) {
            return false;
        }
        return language.indicators().stream().anyMatch(stdout::contains);
    }

    public static int score(boolean confirmed) {
        return confirmed ? CONFIRMED_SCORE : UNCONFIRMED_SCORE;
    }
}
