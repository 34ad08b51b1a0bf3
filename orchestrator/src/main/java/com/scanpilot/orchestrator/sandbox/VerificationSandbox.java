package com.scanpilot.orchestrator.sandbox;

import com.scanpilot.orchestrator.process.ProcessOutcome;
import com.scanpilot.orchestrator.process.ProcessRunner;
import com.scanpilot.orchestrator.process.ProcessSpec;
import com.scanpilot.orchestrator.process.ProcessTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Runs generated verification code in an isolated child process.
 *
 * <p>Each run gets its own directory {@code <root>/<jobId>/}, created fresh
 * and never reused, holding a single file {@code verify_<jobId>.<ext>}.
 * The child runs with that directory as cwd, a cleared environment (only
 * PATH, TARGET_URL and the interpreter's module path), a hard timeout and
 * capped output.
 */
@Component
public class VerificationSandbox {

    private static final Logger log = LoggerFactory.getLogger(VerificationSandbox.class);

    private final ProcessRunner     runner;
    private final SandboxProperties props;

    public VerificationSandbox(ProcessRunner runner, SandboxProperties props) {
        this.runner = runner;
        this.props  = props;
    }

    public VerificationResult execute(VerificationJob job) {
        return execute(job, ProcessTracker.NONE);
    }

    /**
     * Write and run {@code job.code()}.
     *
     * @throws UnsupportedLanguageException before anything is written, for an unknown language
     * @throws SandboxExecutionException    if the directory, the file or the process cannot be set up
     */
    public VerificationResult execute(VerificationJob job, ProcessTracker tracker) {
        SandboxLanguage language = SandboxLanguage.fromWire(job.language());
        String runtime = props.getRuntimes().getOrDefault(language.runtimeKey(), language.runtimeKey());

        Path dir = directoryFor(job.id());
        Path codeFile = dir.resolve("verify_" + job.id() + "." + language.extension());
        try {
            Files.createDirectories(dir.getParent());
            Files.createDirectory(dir);
            Files.writeString(codeFile, job.code() == null ? "" : job.code(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SandboxExecutionException("Cannot prepare sandbox for verification " + job.id(), e);
        }

        List<String> command = new ArrayList<>();
        command.add(runtime);
        command.add(codeFile.toString());
        if (language.positionalArgs()) {
            if (job.target() != null && !job.target().isBlank()) {
                command.add(job.target());
            }
            command.addAll(job.parameters().values());
        }

        Duration timeout = resolveTimeout(job.timeoutMs());
        log.info("Running {} verification {} for finding {} (timeout={} ms)",
                language.runtimeKey(), job.id(), job.findingId(), timeout.toMillis());

        ProcessOutcome out;
        try {
            out = runner.run(new ProcessSpec(command, dir, environment(language, dir, job.target()),
                    false, timeout, props.getMaxOutputBytes()), tracker);
        } catch (IOException e) {
            throw new SandboxExecutionException("Cannot start " + runtime + " for verification " + job.id(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxExecutionException("Interrupted during verification " + job.id(), e);
        }

        boolean confirmed = ConfirmationHeuristic.confirmed(language, out.stdout());
        String error = out.timedOut()
                ? "Verification timed out after " + timeout.toMillis() + " ms"
                : out.stderr().isBlank() ? null : out.stderr();
        log.info("Verification {} finished: exit={}, confirmed={}, {} ms",
                job.id(), out.exitCode(), confirmed, out.durationMs());
        return new VerificationResult(out.succeeded(), confirmed, out.stdout(), error,
                out.durationMs(), ConfirmationHeuristic.score(confirmed));
    }

    /** Delete a run's directory. Failures are logged, never thrown. */
    public void purge(String jobId) {
        Path dir = directoryFor(jobId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    log.warn("Could not delete sandbox file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up sandbox directory {}: {}", dir, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    Path directoryFor(String jobId) {
        if (jobId == null || jobId.isBlank() || jobId.contains("/") || jobId.contains("\\") || jobId.contains("..")) {
            throw new IllegalArgumentException("Invalid verification id: " + jobId);
        }
        return Paths.get(props.getRoot()).toAbsolutePath().normalize().resolve(jobId);
    }

    private Duration resolveTimeout(long requestedMs) {
        long ms = requestedMs > 0 ? requestedMs : props.getDefaultTimeoutMs();
        return Duration.ofMillis(Math.min(ms, props.getMaxTimeoutMs()));
    }

    private static Map<String, String> environment(SandboxLanguage language, Path dir, String target) {
        Map<String, String> env = new LinkedHashMap<>();
        String path = System.getenv("PATH");
        if (path != null) {
            env.put("PATH", path);
        }
        env.put("TARGET_URL", target == null ? "" : target);
        switch (language) {
            case PYTHON     -> env.put("PYTHONPATH", dir.toString());
            case JAVASCRIPT -> env.put("NODE_PATH", dir.toString());
            case SHELL      -> { }
        }
        return env;
    }
}
