package com.scanpilot.orchestrator.api.dto;

import com.scanpilot.orchestrator.tool.OutputFormat;
import com.scanpilot.orchestrator.tool.ToolInvocationSpec;

import java.util.List;
import java.util.Locale;

/**
 * Request body for POST /api/tools.
 *
 * Required: name, command. A missing timeout means five minutes, a missing
 * output format means plain text.
 */
public record ToolSpecRequest(String name, String command, String version, Long timeoutMs,
                              List<String> allowedArgs, String outputFormat) {

    static final long DEFAULT_TIMEOUT_MS = 300_000;

    /** @throws IllegalArgumentException if the spec is incomplete */
    public ToolInvocationSpec toSpec() {
        OutputFormat format = outputFormat == null || outputFormat.isBlank()
                ? OutputFormat.TEXT
                : OutputFormat.valueOf(outputFormat.trim().toUpperCase(Locale.ROOT));
        return new ToolInvocationSpec(name, command, version,
                timeoutMs == null ? DEFAULT_TIMEOUT_MS : timeoutMs, allowedArgs, format);
    }
}
