package com.scanpilot.orchestrator.model;

/** Level of a persisted job log line (not the application log). */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
