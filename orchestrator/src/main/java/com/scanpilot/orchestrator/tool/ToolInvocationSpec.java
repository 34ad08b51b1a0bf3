package com.scanpilot.orchestrator.tool;

import java.util.List;

/**
 * Static description of an external security tool.
 *
 * Lives only in memory: built-in defaults are overlaid with configuration at
 * startup and may be changed at runtime through the registry.
 *
 * @param command            executable name or absolute path, run without a shell
 * @param timeoutMs          default wall-clock limit for one run
 * @param allowedArgPrefixes every flag-shaped argument must start with one of these
 */
public record ToolInvocationSpec(
        String       name,
        String       command,
        String       version,
        long         timeoutMs,
        List<String> allowedArgPrefixes,
        OutputFormat outputFormat) {

    public ToolInvocationSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name cannot be empty");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("tool command cannot be empty: " + name);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("tool timeout must be positive: " + name);
        }
        allowedArgPrefixes = allowedArgPrefixes == null ? List.of() : List.copyOf(allowedArgPrefixes);
        outputFormat       = outputFormat == null ? OutputFormat.TEXT : outputFormat;
    }
}
