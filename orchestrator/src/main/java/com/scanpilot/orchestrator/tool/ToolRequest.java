package com.scanpilot.orchestrator.tool;

import com.scanpilot.orchestrator.process.ProcessTracker;

import java.time.Duration;
import java.util.List;

/**
 * One tool invocation.
 *
 * @param target          appended as the final argument; null for none
 * @param timeoutOverride replaces the tool's default timeout; clamped to the configured ceiling
 * @param tracker         receives the child process so the owning job can kill it
 */
public record ToolRequest(
        String         toolName,
        List<String>   args,
        String         target,
        Duration       timeoutOverride,
        ProcessTracker tracker) {

    public ToolRequest {
        args    = args == null ? List.of() : List.copyOf(args);
        tracker = tracker == null ? ProcessTracker.NONE : tracker;
    }

    public static ToolRequest of(String toolName, List<String> args, String target) {
        return new ToolRequest(toolName, args, target, null, ProcessTracker.NONE);
    }
}
