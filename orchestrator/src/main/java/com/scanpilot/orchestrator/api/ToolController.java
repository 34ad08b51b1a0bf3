package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.api.dto.ControlResponse;
import com.scanpilot.orchestrator.api.dto.ToolSpecRequest;
import com.scanpilot.orchestrator.tool.ToolHealth;
import com.scanpilot.orchestrator.tool.ToolInvocationSpec;
import com.scanpilot.orchestrator.tool.ToolInvocationService;
import com.scanpilot.orchestrator.tool.ToolRegistry;
import com.scanpilot.orchestrator.tool.UnknownToolException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * GET    /api/tools          configured tool specs
 * GET    /api/tools/status   check every tool with --version
 * POST   /api/tools          add or replace a tool
 * DELETE /api/tools/{name}
 */
@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry          registry;
    private final ToolInvocationService invocations;

    public ToolController(ToolRegistry registry, ToolInvocationService invocations) {
        this.registry    = registry;
        this.invocations = invocations;
    }

    @GetMapping
    public Map<String, Object> list() {
        List<ToolInvocationSpec> tools = registry.list();
        return Map.of("success", true, "tools", tools);
    }

    /** Runs the checks sequentially, so this can take a few seconds per tool. */
    @GetMapping("/status")
    public ToolHealth.Report status() {
        return invocations.healthStatus();
    }

    @PostMapping
    public ResponseEntity<ControlResponse> add(@RequestBody ToolSpecRequest req) {
        registry.add(req.toSpec());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ControlResponse(true, "Tool '" + req.name() + "' configured"));
    }

    @DeleteMapping("/{name}")
    public ControlResponse remove(@PathVariable String name) {
        if (!registry.remove(name)) {
            throw new UnknownToolException(name);
        }
        return new ControlResponse(true, "Tool '" + name + "' removed");
    }
}
