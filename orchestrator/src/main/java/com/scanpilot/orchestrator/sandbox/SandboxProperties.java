package com.scanpilot.orchestrator.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verification sandbox configuration, bound from {@code scanpilot.sandbox.*}.
 * {@code runtimes} maps a language key (python, javascript, shell) to its interpreter.
 */
@Component
@ConfigurationProperties(prefix = "scanpilot.sandbox")
public class SandboxProperties {

    private String root             = "./sandbox";
    private long   defaultTimeoutMs = 60_000;
    private long   maxTimeoutMs     = 300_000;
    private int    maxOutputBytes   = 1024 * 1024;

    private Map<String, String> runtimes = new LinkedHashMap<>(Map.of(
            "python",     "python3",
            "javascript", "node",
            "shell",      "bash"));

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }

    public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
    public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

    public long getMaxTimeoutMs() { return maxTimeoutMs; }
    public void setMaxTimeoutMs(long maxTimeoutMs) { this.maxTimeoutMs = maxTimeoutMs; }

    public int getMaxOutputBytes() { return maxOutputBytes; }
    public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }

    public Map<String, String> getRuntimes() { return runtimes; }
    public void setRuntimes(Map<String, String> runtimes) { this.runtimes = runtimes; }
}
