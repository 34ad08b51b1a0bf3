package com.scanpilot.orchestrator.tool;

import com.scanpilot.orchestrator.process.ProcessOutcome;
import com.scanpilot.orchestrator.process.ProcessRunner;
import com.scanpilot.orchestrator.process.ProcessSpec;
import com.scanpilot.orchestrator.process.ProcessTracker;
import com.scanpilot.orchestrator.tool.parser.ToolOutputParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs external security tools under the argument safety policy.
 *
 * <p>Every call goes through the same steps:
 * <ol>
 *   <li>Look the tool up in the {@link ToolRegistry}.</li>
 *   <li>Check all arguments and the target with {@link ArgumentPolicy}.
 *       A violation is logged on the {@code scanpilot.security} logger and
 *       rethrown; nothing is spawned.</li>
 *   <li>Run {@code command args... target} as an argument vector with a
 *       hard timeout and capped output.</li>
 *   <li>Parse stdout with the tool's {@link ToolOutputParser}, if it has one.</li>
 * </ol>
 *
 * Metrics:
 * <pre>
 *   scanpilot.tool.calls{tool, status="success|error|timeout|policy_violation"}
 *   scanpilot.tool.duration{tool}
 * </pre>
 */
@Service
public class ToolInvocationService {

    private static final Logger log         = LoggerFactory.getLogger(ToolInvocationService.class);
    private static final Logger securityLog = LoggerFactory.getLogger("scanpilot.security");

    private static final int MAX_ERROR_CHARS = 2_000;

    private final ToolRegistry  registry;
    private final ProcessRunner runner;
    private final ToolProperties props;
    private final MeterRegistry meterRegistry;
    private final Map<String, ToolOutputParser<?>> parsers = new LinkedHashMap<>();

    public ToolInvocationService(ToolRegistry registry,
                                 ProcessRunner runner,
                                 ToolProperties props,
                                 MeterRegistry meterRegistry,
                                 List<ToolOutputParser<?>> allParsers) {
        this.registry      = registry;
        this.runner        = runner;
        this.props         = props;
        this.meterRegistry = meterRegistry;
        for (ToolOutputParser<?> parser : allParsers) {
            parsers.put(parser.toolName(), parser);
        }
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Run one tool.
     *
     * A non-zero exit, a timeout or a start failure is reported as
     * {@code success=false} in the result rather than thrown.
     *
     * @throws UnknownToolException        if the tool is not configured
     * @throws UnsafeArgumentException     on a shell metacharacter in an argument or the target
     * @throws DisallowedArgumentException on a flag outside the tool's allow-list
     */
    public ToolResult execute(ToolRequest request) {
        ToolInvocationSpec spec = registry.get(request.toolName());
        try {
            ArgumentPolicy.check(spec, request.args(), request.target());
        } catch (ToolPolicyException e) {
            securityLog.warn("Rejected invocation of '{}': {}", spec.name(), e.getMessage());
            meterRegistry.counter("scanpilot.tool.calls",
                    "tool", spec.name(), "status", "policy_violation").increment();
            throw e;
        }

        List<String> command = new ArrayList<>();
        command.add(spec.command());
        command.addAll(request.args());
        if (request.target() != null && !request.target().isBlank()) {
            command.add(request.target());
        }
        Duration timeout = resolveTimeout(spec, request.timeoutOverride());
        log.info("Executing tool '{}' against {} (args={}, timeout={} ms)",
                spec.name(), request.target(), request.args(), timeout.toMillis());

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            ProcessOutcome out = runner.run(
                    new ProcessSpec(command, null, Map.of(), true, timeout, props.getMaxOutputBytes()),
                    request.tracker());

            if (out.timedOut()) {
                status = "timeout";
                String error = "Tool '" + spec.name() + "' timed out after " + timeout.toMillis() + " ms";
                log.warn(error);
                return ToolResult.failure(out.stdout(), out.exitCode(), out.durationMs(), error);
            }
            if (out.exitCode() != 0) {
                status = "error";
                String error = "Tool '" + spec.name() + "' exited with code " + out.exitCode()
                        + tail(out.stderr());
                log.warn(error);
                return ToolResult.failure(out.stdout(), out.exitCode(), out.durationMs(), error);
            }

            log.info("Tool '{}' completed in {} ms{}", spec.name(), out.durationMs(),
                    out.truncated() ? " (output truncated)" : "");
            return new ToolResult(true, out.stdout(), parse(spec.name(), out.stdout()),
                    0, out.durationMs(), out.stderr().isBlank() ? null : out.stderr());
        } catch (IOException e) {
            status = "error";
            log.error("Could not start tool '{}' ({}): {}", spec.name(), spec.command(), e.getMessage());
            return ToolResult.failure("", -1, 0, "Could not start tool '" + spec.name() + "': " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = "error";
            return ToolResult.failure("", -1, 0, "Interrupted while running tool '" + spec.name() + "'");
        } finally {
            sample.stop(meterRegistry.timer("scanpilot.tool.duration", "tool", spec.name()));
            if (!"policy_violation".equals(status)) {
                meterRegistry.counter("scanpilot.tool.calls", "tool", spec.name(), "status", status).increment();
            }
        }
    }

    /** The effective timeout: override if positive, else the tool default, never above the ceiling. */
    Duration resolveTimeout(ToolInvocationSpec spec, Duration override) {
        long ms = (override != null && !override.isNegative() && !override.isZero())
                ? override.toMillis()
                : spec.timeoutMs();
        return Duration.ofMillis(Math.min(ms, props.getMaxTimeoutMs()));
    }

    // ------------------------------------------------------------------
    // Health
    // ------------------------------------------------------------------

    /** Probe a tool with {@code --version}. Never throws. */
    public ToolHealth validateTool(String name) {
        ToolInvocationSpec spec = registry.find(name).orElse(null);
        if (spec == null) {
            return new ToolHealth(false, null, "Tool not configured");
        }
        try {
            ProcessOutcome out = runner.run(
                    new ProcessSpec(List.of(spec.command(), "--version"), null, Map.of(), true,
                            Duration.ofMillis(props.getProbeTimeoutMs()), 64 * 1024),
                    ProcessTracker.NONE);
            if (out.succeeded()) {
                return new ToolHealth(true, firstLine(out.stdout()), null);
            }
            return new ToolHealth(false, null, out.timedOut()
                    ? "Version probe timed out"
                    : "Version probe exited with code " + out.exitCode());
        } catch (IOException e) {
            return new ToolHealth(false, null, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ToolHealth(false, null, "Interrupted");
        }
    }

    /** Probe every configured tool in name order. */
    public ToolHealth.Report healthStatus() {
        Map<String, ToolHealth> tools = new LinkedHashMap<>();
        for (String name : registry.names()) {
            tools.put(name, validateTool(name));
        }
        boolean allAvailable = tools.values().stream().allMatch(ToolHealth::available);
        return new ToolHealth.Report(allAvailable ? "healthy" : "degraded", tools);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Object parse(String toolName, String stdout) {
        ToolOutputParser<?> parser = parsers.get(toolName);
        if (parser == null) {
            return null;
        }
        try {
            return parser.parse(stdout);
        } catch (RuntimeException e) {
            log.warn("Could not parse output of '{}', keeping raw output only: {}", toolName, e.getMessage());
            return null;
        }
    }

    private static String tail(String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "";
        }
        String s = stderr.strip();
        return ": " + (s.length() <= MAX_ERROR_CHARS ? s : "..." + s.substring(s.length() - MAX_ERROR_CHARS));
    }

    private static String firstLine(String s) {
        String trimmed = s.strip();
        int nl = trimmed.indexOf('\n');
        return nl < 0 ? trimmed : trimmed.substring(0, nl).strip();
    }
}
