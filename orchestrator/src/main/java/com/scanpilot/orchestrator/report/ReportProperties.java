package com.scanpilot.orchestrator.report;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Bound from {@code scanpilot.reports.*}. */
@Component
@ConfigurationProperties(prefix = "scanpilot.reports")
public class ReportProperties {

    private String directory = "./reports";

    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }
}
