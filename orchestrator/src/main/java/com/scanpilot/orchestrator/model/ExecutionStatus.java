package com.scanpilot.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one job attempt.
 *
 * Transitions:
 *   PENDING → RUNNING   (a worker slot picked the job up)
 *   RUNNING ⇄ PAUSED    (operator control, observed at stage boundaries)
 *   RUNNING → COMPLETED (report assembled)
 *   RUNNING | PAUSED → FAILED (uncaught stage error)
 *   PENDING | RUNNING | PAUSED → CANCELLED
 *   PENDING → FAILED    (dispatch attempts exhausted before the job ever started)
 *
 * COMPLETED, FAILED and CANCELLED are terminal: no transition leaves them.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** RUNNING or PAUSED: a worker currently owns the job. */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return allowedNext().contains(next);
    }

    private Set<ExecutionStatus> allowedNext() {
        return switch (this) {
            case PENDING   -> EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING   -> EnumSet.of(PAUSED, COMPLETED, FAILED, CANCELLED);
            case PAUSED    -> EnumSet.of(RUNNING, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(ExecutionStatus.class);
        };
    }

    /** Lower-case wire name used by the REST API and dashboards. */
    public String wireName() {
        return name().toLowerCase();
    }
}
