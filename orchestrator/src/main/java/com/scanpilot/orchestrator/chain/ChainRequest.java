package com.scanpilot.orchestrator.chain;

import com.scanpilot.orchestrator.ai.AiSession;
import com.scanpilot.orchestrator.model.Strategy;
import com.scanpilot.orchestrator.process.ProcessTracker;

import java.util.List;

/**
 * Everything a chain run needs to know about the task.
 *
 * @param tracker  receives tool processes so cancellation can kill them
 * @param listener job log sink and stop signal
 */
public record ChainRequest(
        String         taskId,
        String         target,
        AiSession      session,
        List<String>   tools,
        Strategy       strategy,
        int            depth,
        List<String>   scope,
        List<String>   excludeRules,
        ProcessTracker tracker,
        ChainListener  listener) {

    public ChainRequest {
        tools        = tools == null ? List.of() : List.copyOf(tools);
        scope        = scope == null ? List.of() : List.copyOf(scope);
        excludeRules = excludeRules == null ? List.of() : List.copyOf(excludeRules);
        tracker      = tracker == null ? ProcessTracker.NONE : tracker;
        listener     = listener == null ? ChainListener.NONE : listener;
    }
}
