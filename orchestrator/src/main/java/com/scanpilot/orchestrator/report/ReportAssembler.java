package com.scanpilot.orchestrator.report;

/**
 * Turns a {@link ReportDocument} into a stored artifact.
 */
public interface ReportAssembler {

    /**
     * @throws UnsupportedReportFormatException if {@code format} has no renderer
     * @throws ReportAssemblyException          if the artifact cannot be written
     */
    ReportArtifact assemble(ReportDocument document, ReportFormat format);
}
