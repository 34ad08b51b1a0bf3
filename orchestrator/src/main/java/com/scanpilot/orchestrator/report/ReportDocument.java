package com.scanpilot.orchestrator.report;

import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.Severity;

import java.util.List;

/**
 * Everything a report shows, independent of output format.
 * Serialised as-is for the JSON format.
 */
public record ReportDocument(Metadata metadata, TaskInfo taskInfo, Summary summary, List<Finding> findings) {

    public static final String VERSION   = "1.0";
    public static final String GENERATOR = "ScanPilot Orchestrator";

    public record Metadata(String version, String generator, long generatedAt) {}

    public record TaskInfo(String taskId, String jobId, String name, String target, String status,
                           Long startedAt, Long completedAt, long durationMs) {}

    public record Summary(int total, int critical, int high, int medium, int low, int info, int verified) {

        public static Summary of(List<Finding> findings) {
            return new Summary(
                    findings.size(),
                    count(findings, Severity.CRITICAL),
                    count(findings, Severity.HIGH),
                    count(findings, Severity.MEDIUM),
                    count(findings, Severity.LOW),
                    count(findings, Severity.INFO),
                    (int) findings.stream().filter(Finding::verified).count());
        }

        private static int count(List<Finding> findings, Severity severity) {
            return (int) findings.stream().filter(f -> f.severity() == severity).count();
        }
    }

    public static ReportDocument of(TaskInfo taskInfo, List<Finding> findings, long now) {
        return new ReportDocument(new Metadata(VERSION, GENERATOR, now), taskInfo,
                Summary.of(findings), List.copyOf(findings));
    }
}
