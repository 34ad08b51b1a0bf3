package com.scanpilot.orchestrator.ai;

import com.scanpilot.orchestrator.model.ModelSelection;

/**
 * Provider session settings handed to the chain executor.
 *
 * @param apiKey never logged or serialised
 */
public record AiSession(ModelSelection selection, String apiKey, double temperature, int maxTokens) {

    @Override
    public String toString() {
        return "AiSession[" + selection.provider() + "/" + selection.model() + "]";
    }
}
