package com.scanpilot.orchestrator.ai;

import com.scanpilot.orchestrator.model.AiProvider;
import com.scanpilot.orchestrator.model.ModelSelection;

import java.util.List;

/**
 * Entry point to the AI provider used by the analysis chain.
 *
 * Prompting and response handling live behind the chain executor; the
 * orchestrator only needs a session bound to the task's model selection.
 */
public interface AiService {

    /**
     * Prepare a session for the selected provider and model.
     *
     * @throws AiServiceException if the provider cannot be used
     */
    AiSession initialize(ModelSelection selection);

    /** Known models per provider, in {@link AiProvider} order. */
    List<ProviderModels> models();

    /** Which providers have credentials configured. */
    AiStatus status();
}
