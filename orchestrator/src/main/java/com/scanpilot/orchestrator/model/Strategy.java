package com.scanpilot.orchestrator.model;

import java.util.Locale;

/** How aggressively the chain explores the target. */
public enum Strategy {
    COMPREHENSIVE,
    FAST,
    DEEP,
    CUSTOM;

    /**
     * Parse the wire value. "quick" is the dashboard's name for {@link #FAST}.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static Strategy fromWire(String value) {
        if (value == null || value.isBlank()) {
            return COMPREHENSIVE;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("quick")) {
            return FAST;
        }
        return Strategy.valueOf(v.toUpperCase(Locale.ROOT));
    }

    /** Default exploration depth when the caller does not supply one. */
    public int defaultDepth() {
        return switch (this) {
            case FAST -> 1;
            case COMPREHENSIVE, CUSTOM -> 2;
            case DEEP -> 3;
        };
    }
}
