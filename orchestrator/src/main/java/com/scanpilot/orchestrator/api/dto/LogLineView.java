package com.scanpilot.orchestrator.api.dto;

import com.scanpilot.orchestrator.service.LogLine;

import java.util.Locale;

public record LogLineView(long timestamp, String level, String message) {

    public static LogLineView from(LogLine line) {
        return new LogLineView(line.timestamp(), line.level().name().toLowerCase(Locale.ROOT), line.message());
    }
}
