package com.scanpilot.orchestrator.tool;

/**
 * Base class for arguments rejected by the tool safety policy.
 * Always raised before any process is started.
 */
public abstract class ToolPolicyException extends RuntimeException {

    private final String toolName;
    private final String argument;

    protected ToolPolicyException(String toolName, String argument, String message) {
        super(message);
        this.toolName = toolName;
        this.argument = argument;
    }

    public String getToolName() { return toolName; }
    public String getArgument() { return argument; }
}
