package com.scanpilot.orchestrator.tool;

/** A flag-shaped argument does not start with any allow-listed prefix. */
public class DisallowedArgumentException extends ToolPolicyException {

    public DisallowedArgumentException(String toolName, String argument) {
        super(toolName, argument, "Argument not allowed for tool '" + toolName + "': " + argument);
    }
}
