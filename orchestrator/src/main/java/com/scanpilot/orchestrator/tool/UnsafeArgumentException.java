package com.scanpilot.orchestrator.tool;

/** An argument or target contains a shell metacharacter or could be read as an option. */
public class UnsafeArgumentException extends ToolPolicyException {

    public UnsafeArgumentException(String toolName, String argument, String reason) {
        super(toolName, argument, "Unsafe argument for tool '" + toolName + "': " + reason + ": " + argument);
    }
}
