package com.scanpilot.orchestrator.report;

public class ReportAssemblyException extends RuntimeException {

    public ReportAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
