package com.scanpilot.orchestrator.chain;

import com.scanpilot.orchestrator.model.Finding;

import java.util.List;

/**
 * What the chain produced. {@code success=false} carries an error and
 * makes the pipeline fail the job.
 */
public record ChainResult(boolean success, List<Finding> findings, List<ToolRun> toolRuns, String error) {

    /** Summary of one tool invocation inside the chain. */
    public record ToolRun(String tool, boolean success, int exitCode, long durationMs) {}

    public ChainResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
        toolRuns = toolRuns == null ? List.of() : List.copyOf(toolRuns);
    }

    public static ChainResult ok(List<Finding> findings, List<ToolRun> toolRuns) {
        return new ChainResult(true, findings, toolRuns, null);
    }

    public static ChainResult failed(String error, List<ToolRun> toolRuns) {
        return new ChainResult(false, List.of(), toolRuns, error);
    }
}
