package com.scanpilot.orchestrator.tool;

/** Native output format a tool is configured to emit. */
public enum OutputFormat {
    TEXT,
    JSON,
    XML
}
