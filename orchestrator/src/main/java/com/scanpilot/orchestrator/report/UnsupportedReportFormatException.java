package com.scanpilot.orchestrator.report;

/** The format is recognised but no renderer exists for it (currently PDF). */
public class UnsupportedReportFormatException extends RuntimeException {

    public UnsupportedReportFormatException(ReportFormat format) {
        super("Report format '" + format.extension() + "' is not supported");
    }
}
