package com.scanpilot.orchestrator.report;

/**
 * A rendered report on disk.
 *
 * @param path absolute file path; stored on the execution record as its report reference
 */
public record ReportArtifact(String reportId, ReportFormat format, String path, long generatedAt) {}
