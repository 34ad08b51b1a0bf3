package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.api.dto.ControlResponse;
import com.scanpilot.orchestrator.api.dto.LogLineView;
import com.scanpilot.orchestrator.api.dto.ReportResponse;
import com.scanpilot.orchestrator.api.dto.SubmitTaskRequest;
import com.scanpilot.orchestrator.api.dto.SubmitTaskResponse;
import com.scanpilot.orchestrator.api.dto.TaskView;
import com.scanpilot.orchestrator.report.ReportFormat;
import com.scanpilot.orchestrator.service.JobNotFoundException;
import com.scanpilot.orchestrator.service.ReportService;
import com.scanpilot.orchestrator.service.SubmitResult;
import com.scanpilot.orchestrator.service.TaskOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for task lifecycle.
 *
 * POST   /api/tasks                  submit a task and queue its job
 * GET    /api/tasks                  all jobs, newest first, last 10 log lines each
 * GET    /api/tasks/{jobId}          one job
 * GET    /api/tasks/{jobId}/logs     full job log
 * POST   /api/tasks/{jobId}/pause    pause at the next stage boundary
 * POST   /api/tasks/{jobId}/resume
 * DELETE /api/tasks/{jobId}          cancel
 * DELETE /api/tasks/{jobId}/record   remove a finished job and its logs
 * GET    /api/tasks/{jobId}/report   ?format=html|json|pdf
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    static final int LIST_LOG_LIMIT = 10;

    private final TaskOrchestrator orchestrator;
    private final ReportService    reports;

    public TaskController(TaskOrchestrator orchestrator, ReportService reports) {
        this.orchestrator = orchestrator;
        this.reports      = reports;
    }

    /**
     * Submit a new assessment task.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/tasks \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"staging","target":"10.0.0.5","ai_model":"gpt-4","tools":["nmap"]}'
     */
    @PostMapping
    public ResponseEntity<SubmitTaskResponse> submit(@RequestBody SubmitTaskRequest req) {
        SubmitResult result = orchestrator.submit(req.toSubmission());
        String message = result.queued() ? "Task created" : "Task created, running without the queue";
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new SubmitTaskResponse(true, result.taskId(), result.jobId(), message));
    }

    @GetMapping
    public Map<String, Object> list() {
        List<TaskView> tasks = orchestrator.listAll(LIST_LOG_LIMIT).stream()
                .map(s -> TaskView.from(s, LIST_LOG_LIMIT))
                .toList();
        return Map.of("success", true, "tasks", tasks);
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/{jobId}")
    public Map<String, Object> get(@PathVariable UUID jobId) {
        TaskView task = orchestrator.getStatus(jobId)
                .map(s -> TaskView.from(s, Integer.MAX_VALUE))
                .orElseThrow(() -> new JobNotFoundException(jobId));
        return Map.of("success", true, "task", task);
    }

    @GetMapping("/{jobId}/logs")
    public Map<String, Object> logs(@PathVariable UUID jobId) {
        List<LogLineView> logs = orchestrator.logs(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId))
                .stream()
                .map(LogLineView::from)
                .toList();
        return Map.of("success", true, "logs", logs);
    }

    // Control actions answer 200 with success=false when the job is not in a
    // state the action applies to.

    @PostMapping("/{jobId}/pause")
    public ControlResponse pause(@PathVariable UUID jobId) {
        return ControlResponse.of(orchestrator.pause(jobId), "Task paused", "Task is not running");
    }

    @PostMapping("/{jobId}/resume")
    public ControlResponse resume(@PathVariable UUID jobId) {
        return ControlResponse.of(orchestrator.resume(jobId), "Task resumed", "Task is not paused");
    }

    @DeleteMapping("/{jobId}")
    public ControlResponse cancel(@PathVariable UUID jobId) {
        return ControlResponse.of(orchestrator.cancel(jobId), "Task cancelled", "Task has already finished");
    }

    @DeleteMapping("/{jobId}/record")
    public ControlResponse delete(@PathVariable UUID jobId) {
        return ControlResponse.of(orchestrator.delete(jobId), "Task deleted", "Task has not finished");
    }

    /**
     * json: the report inline. html: a reference to the rendered file.
     * pdf: 501.
     */
    @GetMapping("/{jobId}/report")
    public ReportResponse report(@PathVariable UUID jobId,
                                 @RequestParam(required = false) String format) {
        return ReportResponse.from(reports.render(jobId, ReportFormat.fromWire(format)));
    }
}
