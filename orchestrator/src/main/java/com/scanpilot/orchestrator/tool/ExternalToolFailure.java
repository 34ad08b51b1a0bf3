package com.scanpilot.orchestrator.tool;

/**
 * A tool ran but did not succeed: non-zero exit, timeout, or it could not
 * be started. {@link ToolInvocationService} reports this inside the
 * {@link ToolResult}; callers that need a hard stop use
 * {@link ToolResult#throwIfFailed(String)}.
 */
public class ExternalToolFailure extends RuntimeException {

    private final String toolName;
    private final int    exitCode;

    public ExternalToolFailure(String toolName, int exitCode, String message) {
        super(message);
        this.toolName = toolName;
        this.exitCode = exitCode;
    }

    public String getToolName() { return toolName; }
    public int    getExitCode() { return exitCode; }
}
