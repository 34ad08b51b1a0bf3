package com.scanpilot.orchestrator.model;

import java.util.Locale;

/** AI providers the chain can be driven by. */
public enum AiProvider {
    OPENAI("OpenAI GPT models"),
    ANTHROPIC("Anthropic Claude models"),
    GEMINI("Google Gemini models");

    private final String description;

    AiProvider(String description) {
        this.description = description;
    }

    public String description() { return description; }

    /** Lower-case name used in config keys and on the wire. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Compatibility shim for clients that only send a model id.
     *
     * Dashboards written against the first API version never sent a provider,
     * so the provider was guessed from the model prefix. New clients should
     * send the provider explicitly; see {@link ModelSelection}.
     */
    public static AiProvider inferFromModel(String model) {
        String m = model == null ? "" : model.trim().toLowerCase(Locale.ROOT);
        if (m.startsWith("gpt") || m.startsWith("o1") || m.startsWith("o3")) return OPENAI;
        if (m.startsWith("claude")) return ANTHROPIC;
        return GEMINI;
    }

    /** @throws IllegalArgumentException for unknown values */
    public static AiProvider fromWire(String value) {
        return AiProvider.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
