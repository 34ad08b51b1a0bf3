package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.TaskDefinition;
import com.scanpilot.orchestrator.report.ReportArtifact;
import com.scanpilot.orchestrator.report.ReportAssembler;
import com.scanpilot.orchestrator.report.ReportDocument;
import com.scanpilot.orchestrator.report.ReportFormat;
import com.scanpilot.orchestrator.report.UnsupportedReportFormatException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * On-demand reports for the API.
 *
 * JSON is returned inline; HTML is written to disk and returned as an
 * artifact reference, reusing the one produced when the job completed
 * while that file still exists.
 */
@Service
public class ReportService {

    /** Either {@code document} (JSON) or {@code artifact} (HTML) is set. */
    public record RenderedReport(ReportFormat format, ReportDocument document, ReportArtifact artifact) {}

    private final ExecutionTracker tracker;
    private final TaskOrchestrator orchestrator;
    private final ReportAssembler  assembler;

    public ReportService(ExecutionTracker tracker, TaskOrchestrator orchestrator, ReportAssembler assembler) {
        this.tracker      = tracker;
        this.orchestrator = orchestrator;
        this.assembler    = assembler;
    }

    /**
     * @throws JobNotFoundException             if there is no such job
     * @throws UnsupportedReportFormatException for PDF
     */
    public RenderedReport render(UUID jobId, ReportFormat format) {
        ExecutionSnapshot snapshot = tracker.snapshot(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        ReportDocument document = documentFor(snapshot);

        return switch (format) {
            case JSON -> new RenderedReport(format, document, null);
            case HTML -> {
                // The stored file may have been deleted through the report archive.
                if (snapshot.status() == ExecutionStatus.COMPLETED && snapshot.reportRef() != null
                        && Files.isRegularFile(Path.of(snapshot.reportRef()))) {
                    yield new RenderedReport(format, null, new ReportArtifact("report_" + jobId, format,
                            snapshot.reportRef(), snapshot.completedAt() == null ? 0 : snapshot.completedAt()));
                }
                yield new RenderedReport(format, null, assembler.assemble(document, format));
            }
            case PDF -> throw new UnsupportedReportFormatException(format);
        };
    }

    private ReportDocument documentFor(ExecutionSnapshot s) {
        TaskDefinition task = orchestrator.task(s.taskId()).orElse(null);
        long duration = s.startedAt() == null ? 0
                : (s.completedAt() != null ? s.completedAt() : System.currentTimeMillis()) - s.startedAt();
        return ReportDocument.of(new ReportDocument.TaskInfo(
                        s.taskId(), s.jobId().toString(),
                        task == null ? s.taskId() : task.getName(),
                        task == null ? null : task.getTarget(),
                        s.status().wireName(), s.startedAt(), s.completedAt(), duration),
                s.findings(), System.currentTimeMillis());
    }
}
