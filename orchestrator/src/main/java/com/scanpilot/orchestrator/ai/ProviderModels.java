package com.scanpilot.orchestrator.ai;

import java.util.List;

public record ProviderModels(String provider, List<String> models, String description) {}
