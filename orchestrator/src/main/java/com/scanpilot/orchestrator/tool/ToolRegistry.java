package com.scanpilot.orchestrator.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory catalogue of the external tools jobs may invoke.
 *
 * Seeded with nmap, sqlmap, nikto and dirb, then overlaid with
 * {@code scanpilot.tools.definitions}. Entries can be added or removed at
 * runtime; nothing here is persisted.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    static final List<ToolInvocationSpec> BUILT_IN = List.of(
            new ToolInvocationSpec("nmap", "nmap", "7.93", 300_000,
                    List.of("-sS", "-sT", "-sU", "-O", "-sV", "-p", "-Pn", "-A", "-T4"),
                    OutputFormat.TEXT),
            new ToolInvocationSpec("sqlmap", "sqlmap", "1.7", 600_000,
                    List.of("-u", "--batch", "--random-agent", "--level", "--risk", "--threads"),
                    OutputFormat.TEXT),
            new ToolInvocationSpec("nikto", "nikto", "2.5.0", 300_000,
                    List.of("-h", "-p", "-Tuning", "-Plugins"),
                    OutputFormat.TEXT),
            new ToolInvocationSpec("dirb", "dirb", "2.22", 300_000,
                    List.of("-w", "-t", "-r", "-l"),
                    OutputFormat.TEXT));

    private final Map<String, ToolInvocationSpec> tools = new ConcurrentHashMap<>();

    public ToolRegistry(ToolProperties props) {
        for (ToolInvocationSpec spec : BUILT_IN) {
            tools.put(spec.name(), spec);
        }
        props.getDefinitions().forEach((name, def) -> {
            ToolInvocationSpec merged = overlay(tools.get(name), name, def);
            tools.put(name, merged);
            log.info("Configured tool '{}' -> {}", name, merged.command());
        });
        log.info("Tool registry ready: {}", names());
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public ToolInvocationSpec get(String name) {
        ToolInvocationSpec spec = name == null ? null : tools.get(name);
        if (spec == null) {
            throw new UnknownToolException(name);
        }
        return spec;
    }

    public Optional<ToolInvocationSpec> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /** All configured tools, sorted by name. */
    public List<ToolInvocationSpec> list() {
        return tools.values().stream()
                .sorted(Comparator.comparing(ToolInvocationSpec::name))
                .toList();
    }

    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Runtime changes
    // ------------------------------------------------------------------

    /** Add a tool, replacing any existing entry with the same name. */
    public void add(ToolInvocationSpec spec) {
        ToolInvocationSpec previous = tools.put(spec.name(), spec);
        log.info("{} tool '{}' ({})", previous == null ? "Added" : "Replaced", spec.name(), spec.command());
    }

    public boolean remove(String name) {
        boolean removed = name != null && tools.remove(name) != null;
        if (removed) {
            log.info("Removed tool '{}'", name);
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ToolInvocationSpec overlay(ToolInvocationSpec base, String name, ToolProperties.Definition def) {
        String command = def.getCommand() != null ? def.getCommand()
                : base != null ? base.command() : null;
        String version = def.getVersion() != null ? def.getVersion()
                : base != null ? base.version() : null;
        long timeoutMs = def.getTimeoutMs() != null ? def.getTimeoutMs()
                : base != null ? base.timeoutMs() : 300_000;
        List<String> allowed = !def.getAllowedArgs().isEmpty() ? def.getAllowedArgs()
                : base != null ? base.allowedArgPrefixes() : List.of();
        OutputFormat format = def.getOutputFormat() != null ? def.getOutputFormat()
                : base != null ? base.outputFormat() : OutputFormat.TEXT;
        return new ToolInvocationSpec(name, command, version, timeoutMs, allowed, format);
    }
}
