package com.scanpilot.orchestrator.model;

/**
 * Explicit {provider, model} pair chosen at submission time.
 *
 * @param provider which API family serves the model
 * @param model    provider-specific model id, e.g. "gpt-4" or "claude-3-opus"
 */
public record ModelSelection(AiProvider provider, String model) {

    /** Build a selection, inferring the provider when the caller did not name one. */
    public static ModelSelection of(String provider, String model) {
        AiProvider p = (provider == null || provider.isBlank())
                ? AiProvider.inferFromModel(model)
                : AiProvider.fromWire(provider);
        return new ModelSelection(p, model);
    }
}
