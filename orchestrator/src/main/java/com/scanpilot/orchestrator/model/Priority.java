package com.scanpilot.orchestrator.model;

import java.util.Locale;

/**
 * Submission priority. Higher {@link #weight()} is dequeued first.
 * Advisory only: there is no preemption of running jobs.
 */
public enum Priority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    URGENT(4);

    private final int weight;

    Priority(int weight) { this.weight = weight; }

    public int weight() { return weight; }

    /** Unknown or missing values fall back to MEDIUM. */
    public static Priority fromWire(String value) {
        if (value == null) return MEDIUM;
        for (Priority p : values()) {
            if (p.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                return p;
            }
        }
        return MEDIUM;
    }
}
