package com.scanpilot.orchestrator.report;

import java.util.Locale;

public enum ReportFormat {
    HTML("html"),
    JSON("json"),
    PDF("pdf");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() { return extension; }

    /** Null or blank means HTML. */
    public static ReportFormat fromWire(String format) {
        if (format == null || format.isBlank()) {
            return HTML;
        }
        try {
            return valueOf(format.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + format);
        }
    }
}
