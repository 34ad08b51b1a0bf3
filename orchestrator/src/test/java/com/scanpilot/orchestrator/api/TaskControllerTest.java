package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.LogLevel;
import com.scanpilot.orchestrator.model.Severity;
import com.scanpilot.orchestrator.report.ReportArtifact;
import com.scanpilot.orchestrator.report.ReportDocument;
import com.scanpilot.orchestrator.report.ReportFormat;
import com.scanpilot.orchestrator.report.UnsupportedReportFormatException;
import com.scanpilot.orchestrator.service.ExecutionSnapshot;
import com.scanpilot.orchestrator.service.JobNotFoundException;
import com.scanpilot.orchestrator.service.LogLine;
import com.scanpilot.orchestrator.service.ReportService;
import com.scanpilot.orchestrator.service.SubmitResult;
import com.scanpilot.orchestrator.service.TaskOrchestrator;
import com.scanpilot.orchestrator.service.TaskSubmission;
import com.scanpilot.orchestrator.service.ValidationException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for TaskController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no scheduler, no tools).
 * The orchestrator and report service are mocks.
 */
@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired MockMvc            mockMvc;
    @MockitoBean TaskOrchestrator orchestrator;
    @MockitoBean ReportService    reports;

    UUID jobId = UUID.randomUUID();

    // ------------------------------------------------------------------
    // POST /api/tasks
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returns201WithIds() throws Exception {
        when(orchestrator.submit(any())).thenReturn(new SubmitResult("task_abc", jobId, true));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"staging","target":"10.0.0.5","ai_model":"gpt-4",
                                 "tools":["nmap"],"strategy":"quick","priority":"urgent",
                                 "scheduled_time":"2030-01-01T00:00:00Z","verify":false}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.taskId").value("task_abc"))
                .andExpect(jsonPath("$.jobId").value(jobId.toString()));

        ArgumentCaptor<TaskSubmission> captor = ArgumentCaptor.forClass(TaskSubmission.class);
        verify(orchestrator).submit(captor.capture());
        TaskSubmission s = captor.getValue();
        assertThat(s.model()).isEqualTo("gpt-4");
        assertThat(s.strategy()).isEqualTo("quick");
        assertThat(s.scheduledAt()).isEqualTo(1_893_456_000_000L);
        assertThat(s.verify()).isFalse();
    }

    @Test
    void submit_missingFields_returns400() throws Exception {
        when(orchestrator.submit(any())).thenThrow(new ValidationException("Missing required field: target"));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"staging","ai_model":"gpt-4"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Missing required field: target"));
    }

    @Test
    void submit_badScheduledTime_returns400() throws Exception {
        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"s","target":"t","ai_model":"gpt-4","scheduled_time":"tomorrow"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    // ------------------------------------------------------------------
    // GET /api/tasks, /api/tasks/{jobId}, /logs
    // ------------------------------------------------------------------

    @Test
    void list_truncatesLogsToTen() throws Exception {
        when(orchestrator.listAll(10)).thenReturn(List.of(snapshot(ExecutionStatus.RUNNING, 15)));

        mockMvc.perform(get("/api/tasks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.tasks[0].status").value("running"))
                .andExpect(jsonPath("$.tasks[0].logs.length()").value(10))
                .andExpect(jsonPath("$.tasks[0].logs[9].message").value("line 15"));
    }

    @Test
    void get_unknownJob_returns404() throws Exception {
        when(orchestrator.getStatus(jobId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/tasks/{jobId}", jobId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void get_existingJob_returnsTask() throws Exception {
        when(orchestrator.getStatus(jobId)).thenReturn(Optional.of(snapshot(ExecutionStatus.PENDING, 1)));

        mockMvc.perform(get("/api/tasks/{jobId}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task.status").value("pending"))
                .andExpect(jsonPath("$.task.progress").value(0));
    }

    @Test
    void logs_returnsAllLines() throws Exception {
        when(orchestrator.logs(jobId)).thenReturn(Optional.of(snapshot(ExecutionStatus.RUNNING, 12).logs()));

        mockMvc.perform(get("/api/tasks/{jobId}/logs", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.logs.length()").value(12))
                .andExpect(jsonPath("$.logs[0].level").value("info"));
    }

    // ------------------------------------------------------------------
    // Control actions
    // ------------------------------------------------------------------

    @Test
    void cancel_finishedJob_returns200WithSuccessFalse() throws Exception {
        when(orchestrator.cancel(jobId)).thenReturn(false);

        mockMvc.perform(delete("/api/tasks/{jobId}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void pause_runningJob_returnsSuccess() throws Exception {
        when(orchestrator.pause(jobId)).thenReturn(true);

        mockMvc.perform(post("/api/tasks/{jobId}/pause", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Task paused"));
    }

    @Test
    void cancel_unknownJob_returns404() throws Exception {
        when(orchestrator.cancel(jobId)).thenThrow(new JobNotFoundException(jobId));

        mockMvc.perform(delete("/api/tasks/{jobId}", jobId))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /api/tasks/{jobId}/report
    // ------------------------------------------------------------------

    @Test
    void report_json_inlinesFindings() throws Exception {
        Finding f = Finding.unverified("finding_1", "open_port", "Open port 22/tcp", "ssh", Severity.INFO, "22/tcp");
        ReportDocument doc = ReportDocument.of(new ReportDocument.TaskInfo("task_1", jobId.toString(), "staging",
                "10.0.0.5", "completed", 1L, 2L, 1L), List.of(f), 3L);
        when(reports.render(jobId, ReportFormat.JSON))
                .thenReturn(new ReportService.RenderedReport(ReportFormat.JSON, doc, null));

        mockMvc.perform(get("/api/tasks/{jobId}/report", jobId).param("format", "json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.format").value("json"))
                .andExpect(jsonPath("$.report.findings").isArray())
                .andExpect(jsonPath("$.report.findings[0].id").value("finding_1"))
                .andExpect(jsonPath("$.report.summary.info").value(1))
                .andExpect(jsonPath("$.artifact").doesNotExist());
    }

    @Test
    void report_html_returnsArtifactReference() throws Exception {
        when(reports.render(jobId, ReportFormat.HTML)).thenReturn(new ReportService.RenderedReport(ReportFormat.HTML,
                null, new ReportArtifact("report_" + jobId, ReportFormat.HTML, "/reports/report.html", 5L)));

        mockMvc.perform(get("/api/tasks/{jobId}/report", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.artifact.path").value("/reports/report.html"));
    }

    @Test
    void report_pdf_returns501() throws Exception {
        when(reports.render(jobId, ReportFormat.PDF)).thenThrow(new UnsupportedReportFormatException(ReportFormat.PDF));

        mockMvc.perform(get("/api/tasks/{jobId}/report", jobId).param("format", "pdf"))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void report_unknownFormat_returns400() throws Exception {
        mockMvc.perform(get("/api/tasks/{jobId}/report", jobId).param("format", "docx"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ExecutionSnapshot snapshot(ExecutionStatus status, int logLines) {
        List<LogLine> logs = new ArrayList<>();
        for (int i = 1; i <= logLines; i++) {
            logs.add(new LogLine(i, LogLevel.INFO, "line " + i, 1_000L + i));
        }
        return new ExecutionSnapshot(jobId, "task_1", status, 0, "queued", 1_000L, null, null,
                List.of(), logs, null, null);
    }
}
