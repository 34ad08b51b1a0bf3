package com.scanpilot.orchestrator.ai;

import java.util.Map;

/**
 * @param status    "healthy" if at least one provider has a key, otherwise "degraded"
 * @param providers provider wire name → key configured
 */
public record AiStatus(String status, Map<String, Boolean> providers) {}
