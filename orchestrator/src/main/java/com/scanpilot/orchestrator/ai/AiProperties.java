package com.scanpilot.orchestrator.ai;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AI provider settings, bound from {@code scanpilot.ai.*}.
 * {@code apiKeys} is keyed by lower-case provider name (openai, anthropic, gemini).
 */
@Component
@ConfigurationProperties(prefix = "scanpilot.ai")
public class AiProperties {

    private double temperature = 0.3;
    private int    maxTokens   = 2048;
    // Refuse to start a job whose provider has no key configured.
    private boolean requireApiKey = false;

    private Map<String, String> apiKeys = new LinkedHashMap<>();

    // Model ids offered to clients, keyed like apiKeys. Not a whitelist.
    private Map<String, List<String>> models = new LinkedHashMap<>(Map.of(
            "openai",    List.of("gpt-4", "gpt-4-turbo", "gpt-3.5-turbo"),
            "anthropic", List.of("claude-3-opus", "claude-3-sonnet", "claude-3-haiku"),
            "gemini",    List.of("gemini-pro", "gemini-pro-vision")));

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

    public boolean isRequireApiKey() { return requireApiKey; }
    public void setRequireApiKey(boolean requireApiKey) { this.requireApiKey = requireApiKey; }

    public Map<String, String> getApiKeys() { return apiKeys; }
    public void setApiKeys(Map<String, String> apiKeys) { this.apiKeys = apiKeys; }

    public Map<String, List<String>> getModels() { return models; }
    public void setModels(Map<String, List<String>> models) { this.models = models; }
}
