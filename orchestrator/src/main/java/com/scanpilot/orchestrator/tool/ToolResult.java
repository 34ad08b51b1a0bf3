package com.scanpilot.orchestrator.tool;

/**
 * Outcome of a tool run.
 *
 * @param structuredFindings typed parser output for known tools, null when
 *                           there is no parser or parsing failed
 * @param error              stderr or failure description; null when empty
 */
public record ToolResult(
        boolean success,
        String  rawOutput,
        Object  structuredFindings,
        int     exitCode,
        long    durationMs,
        String  error) {

    static ToolResult failure(String rawOutput, int exitCode, long durationMs, String error) {
        return new ToolResult(false, rawOutput, null, exitCode, durationMs, error);
    }

    /** @throws ExternalToolFailure if this run did not succeed */
    public ToolResult throwIfFailed(String toolName) {
        if (!success) {
            throw new ExternalToolFailure(toolName, exitCode, error);
        }
        return this;
    }
}
