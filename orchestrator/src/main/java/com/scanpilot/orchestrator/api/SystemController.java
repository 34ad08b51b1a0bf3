package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.service.TaskOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/system")
public class SystemController {

    private final TaskOrchestrator orchestrator;

    public SystemController(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /** Queue depth and worker occupancy. {@code available=false} when the queue table cannot be read. */
    @GetMapping("/stats")
    public Map<String, Object> stats() {
        return Map.of("success", true, "stats", orchestrator.queueStats());
    }
}
