package com.scanpilot.orchestrator.tool;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/** Availability probe result for one tool. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolHealth(boolean available, String version, String error) {

    /** Aggregate across all configured tools: "healthy" only if every probe succeeded. */
    public record Report(String status, Map<String, ToolHealth> tools) {}
}
