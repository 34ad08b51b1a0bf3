package com.scanpilot.orchestrator.tool;

public class UnknownToolException extends RuntimeException {

    public UnknownToolException(String toolName) {
        super("Tool not found: " + toolName);
    }
}
