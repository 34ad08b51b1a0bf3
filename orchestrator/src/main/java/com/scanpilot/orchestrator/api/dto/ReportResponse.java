package com.scanpilot.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scanpilot.orchestrator.report.ReportArtifact;
import com.scanpilot.orchestrator.report.ReportDocument;
import com.scanpilot.orchestrator.service.ReportService.RenderedReport;

/**
 * Response body for GET /api/tasks/{jobId}/report.
 *
 * json: {@code report} holds the whole document, findings included.
 * html: {@code artifact} points at the file on disk.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportResponse(boolean success, String format, ReportDocument report, ReportArtifact artifact) {

    public static ReportResponse from(RenderedReport r) {
        return new ReportResponse(true, r.format().extension(), r.document(), r.artifact());
    }
}
