package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.model.LogEntry;
import com.scanpilot.orchestrator.model.LogLevel;

/** In-memory copy of one job log line. */
public record LogLine(long sequence, LogLevel level, String message, long timestamp) {

    public static LogLine from(LogEntry entry) {
        return new LogLine(entry.getSequence(), entry.getLevel(), entry.getMessage(), entry.getTimestamp());
    }
}
