package com.scanpilot.orchestrator.report;

/**
 * A report file found in the report directory.
 *
 * @param reportId  {@code report_<jobId>}, shared by every format of one job's report
 * @param createdAt file modification time, epoch millis
 */
public record StoredReport(String reportId, String jobId, String fileName, ReportFormat format,
                           long sizeBytes, long createdAt) {}
