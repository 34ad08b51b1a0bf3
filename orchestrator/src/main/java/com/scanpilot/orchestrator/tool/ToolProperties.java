package com.scanpilot.orchestrator.tool;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool layer configuration, bound from {@code scanpilot.tools.*}.
 *
 * <pre>
 * scanpilot:
 *   tools:
 *     max-output-bytes: 52428800
 *     definitions:
 *       nmap:
 *         command: /usr/local/bin/nmap
 *         timeout-ms: 600000
 * </pre>
 *
 * A definition with the name of a built-in tool replaces only the fields it sets.
 */
@Component
@ConfigurationProperties(prefix = "scanpilot.tools")
public class ToolProperties {

    private int  maxOutputBytes = 50 * 1024 * 1024;
    private long probeTimeoutMs = 10_000;
    private long maxTimeoutMs   = 30 * 60 * 1000;

    private Map<String, Definition> definitions = new LinkedHashMap<>();

    public int getMaxOutputBytes() { return maxOutputBytes; }
    public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }

    public long getProbeTimeoutMs() { return probeTimeoutMs; }
    public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

    public long getMaxTimeoutMs() { return maxTimeoutMs; }
    public void setMaxTimeoutMs(long maxTimeoutMs) { this.maxTimeoutMs = maxTimeoutMs; }

    public Map<String, Definition> getDefinitions() { return definitions; }
    public void setDefinitions(Map<String, Definition> definitions) { this.definitions = definitions; }

    public static class Definition {

        private String       command;
        private String       version;
        private Long         timeoutMs;
        private List<String> allowedArgs = new ArrayList<>();
        private OutputFormat outputFormat;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        public Long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(Long timeoutMs) { this.timeoutMs = timeoutMs; }

        public List<String> getAllowedArgs() { return allowedArgs; }
        public void setAllowedArgs(List<String> allowedArgs) { this.allowedArgs = allowedArgs; }

        public OutputFormat getOutputFormat() { return outputFormat; }
        public void setOutputFormat(OutputFormat outputFormat) { this.outputFormat = outputFormat; }
    }
}
