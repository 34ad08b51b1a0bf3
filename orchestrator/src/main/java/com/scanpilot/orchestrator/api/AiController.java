package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.ai.AiService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * GET /api/ai/models   model ids offered per provider
 * GET /api/ai/status   which providers have an API key configured
 */
@RestController
@RequestMapping("/api/ai")
public class AiController {

    private final AiService ai;

    public AiController(AiService ai) {
        this.ai = ai;
    }

    @GetMapping("/models")
    public Map<String, Object> models() {
        return Map.of("success", true, "models", ai.models());
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return Map.of("success", true, "status", ai.status());
    }
}
