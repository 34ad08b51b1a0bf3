package com.scanpilot.orchestrator.chain;

import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.LogLevel;
import com.scanpilot.orchestrator.model.Severity;
import com.scanpilot.orchestrator.model.Strategy;
import com.scanpilot.orchestrator.tool.ToolInvocationService;
import com.scanpilot.orchestrator.tool.ToolPolicyException;
import com.scanpilot.orchestrator.tool.ToolRegistry;
import com.scanpilot.orchestrator.tool.ToolRequest;
import com.scanpilot.orchestrator.tool.ToolResult;
import com.scanpilot.orchestrator.tool.UnknownToolException;
import com.scanpilot.orchestrator.tool.parser.DirbOutputParser.DirbReport;
import com.scanpilot.orchestrator.tool.parser.NiktoOutputParser.NiktoReport;
import com.scanpilot.orchestrator.tool.parser.NmapOutputParser.NmapReport;
import com.scanpilot.orchestrator.tool.parser.SqlmapOutputParser.SqlmapReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Default chain: runs each requested tool once with strategy-specific
 * arguments and maps the parsed output to findings.
 *
 * <pre>
 *   nmap   open port           → open_port            INFO
 *   sqlmap injectable param    → sql_injection        HIGH
 *   nikto  reported item       → web_misconfiguration MEDIUM
 *   dirb   discovered path     → exposed_path         LOW
 * </pre>
 *
 * A tool that fails is logged and skipped. The chain fails only if every
 * tool it tried failed, or if an argument was rejected by the safety policy.
 */
@Component
public class ToolSweepChainExecutor implements ChainExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolSweepChainExecutor.class);

    private final ToolInvocationService tools;
    private final ToolRegistry          registry;

    public ToolSweepChainExecutor(ToolInvocationService tools, ToolRegistry registry) {
        this.tools    = tools;
        this.registry = registry;
    }

    @Override
    public ChainResult execute(ChainRequest request) {
        ChainListener listener = request.listener();
        List<Finding> findings = new ArrayList<>();
        List<ChainResult.ToolRun> runs = new ArrayList<>();

        for (String tool : request.tools()) {
            if (listener.stopRequested()) {
                return ChainResult.failed("Chain stopped before running " + tool, runs);
            }
            if (request.excludeRules().contains(tool)) {
                listener.log(LogLevel.INFO, "Skipping excluded tool " + tool);
                continue;
            }
            if (!registry.contains(tool)) {
                listener.log(LogLevel.WARN, "Tool " + tool + " is not configured, skipped");
                continue;
            }

            listener.log(LogLevel.INFO, "Running " + tool + " against " + request.target());
            ToolResult result;
            try {
                result = tools.execute(new ToolRequest(tool, argsFor(tool, request.strategy(), request.depth()),
                        request.target(), null, request.tracker()));
            } catch (ToolPolicyException | UnknownToolException e) {
                listener.log(LogLevel.ERROR, e.getMessage());
                return ChainResult.failed(e.getMessage(), runs);
            }
            runs.add(new ChainResult.ToolRun(tool, result.success(), result.exitCode(), result.durationMs()));

            if (!result.success()) {
                listener.log(LogLevel.WARN, tool + " failed: " + result.error());
                continue;
            }
            List<Finding> found = toFindings(request.target(), result.structuredFindings());
            findings.addAll(found);
            listener.log(LogLevel.INFO, tool + " finished in " + result.durationMs() + " ms, "
                    + found.size() + " finding(s)");
        }

        if (!runs.isEmpty() && runs.stream().noneMatch(ChainResult.ToolRun::success)) {
            return ChainResult.failed("All tools failed", runs);
        }
        log.info("Chain for task {} produced {} finding(s) from {} tool run(s)",
                request.taskId(), findings.size(), runs.size());
        return ChainResult.ok(findings, runs);
    }

    // ------------------------------------------------------------------
    // Arguments
    // ------------------------------------------------------------------

    static List<String> argsFor(String tool, Strategy strategy, int depth) {
        return switch (tool) {
            case "nmap" -> switch (strategy) {
                case FAST          -> List.of("-T4", "-Pn");
                case DEEP          -> List.of("-sV", "-O", "-A", "-T4", "-Pn");
                case COMPREHENSIVE, CUSTOM -> List.of("-sV", "-T4", "-Pn");
            };
            case "sqlmap" -> List.of("--batch", "--random-agent",
                    "--level=" + Math.min(5, Math.max(1, depth + 1)),
                    "--risk=" + Math.min(3, Math.max(1, depth)),
                    "-u");
            case "nikto" -> List.of("-h");
            case "dirb"  -> strategy == Strategy.FAST ? List.of("-r") : List.of();
            default      -> List.of();
        };
    }

    // ------------------------------------------------------------------
    // Findings
    // ------------------------------------------------------------------

    static List<Finding> toFindings(String target, Object parsed) {
        List<Finding> out = new ArrayList<>();
        if (parsed instanceof NmapReport nmap) {
            nmap.openPorts().forEach(p -> out.add(Finding.unverified(newId(), "open_port",
                    "Open port " + p.port() + "/" + p.protocol() + " (" + p.service() + ")",
                    p.version() == null ? "Service " + p.service() : "Service " + p.service() + " " + p.version(),
                    Severity.INFO, target + ":" + p.port() + "/" + p.protocol())));
        } else if (parsed instanceof SqlmapReport sqlmap) {
            sqlmap.parameters().forEach(p -> out.add(Finding.unverified(newId(), "sql_injection",
                    "SQL injection in parameter " + p.parameter(),
                    "sqlmap reports parameter '" + p.parameter() + "' (" + p.place() + ") as injectable",
                    Severity.HIGH, p.parameter())));
        } else if (parsed instanceof NiktoReport nikto) {
            nikto.items().forEach(i -> out.add(Finding.unverified(newId(), "web_misconfiguration",
                    i.category(), i.description(), Severity.MEDIUM, target)));
        } else if (parsed instanceof DirbReport dirb) {
            dirb.directories().forEach(e -> out.add(exposedPath(e.path(), e.status())));
            dirb.files().forEach(e -> out.add(exposedPath(e.path(), e.status())));
        }
        return out;
    }

    private static Finding exposedPath(String path, String status) {
        return Finding.unverified(newId(), "exposed_path", "Reachable path " + path,
                "dirb found " + path + " (" + status + ")", Severity.LOW, path);
    }

    private static String newId() {
        return "finding_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
