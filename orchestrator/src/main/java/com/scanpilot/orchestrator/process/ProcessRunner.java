package com.scanpilot.orchestrator.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a child process from an argument vector with a hard timeout and
 * bounded output capture. Shared by the tool layer and the sandbox.
 *
 * Both streams are drained on background threads while we wait, so a chatty
 * child can never block on a full pipe. On timeout the child and all of its
 * descendants are destroyed forcibly.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    // Grace period for stream readers after the child has exited or been killed.
    private static final long DRAIN_GRACE_MS = 2_000;

    private static final AtomicInteger READER_SEQ = new AtomicInteger();
    private static final ExecutorService READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-reader-" + READER_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final ProcessLauncher launcher;

    @Autowired
    public ProcessRunner() {
        this(ProcessBuilder::start);
    }

    public ProcessRunner(ProcessLauncher launcher) {
        this.launcher = launcher;
    }

    /**
     * Run {@code spec} to completion or timeout.
     *
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted; the child is killed first
     */
    public ProcessOutcome run(ProcessSpec spec, ProcessTracker tracker)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(spec.command());
        if (spec.workingDirectory() != null) {
            pb.directory(spec.workingDirectory().toFile());
        }
        Map<String, String> env = pb.environment();
        if (!spec.inheritEnvironment()) {
            env.clear();
        }
        env.putAll(spec.environment());

        long start = System.nanoTime();
        Process process = launcher.launch(pb);
        tracker.track(process);
        try {
            process.getOutputStream().close();   // no stdin

            AtomicBoolean truncated = new AtomicBoolean(false);
            Capture stdout = drain(process.getInputStream(), spec.maxOutputBytes(), truncated);
            Capture stderr = drain(process.getErrorStream(), spec.maxOutputBytes(), truncated);

            boolean finished;
            try {
                finished = process.waitFor(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                destroyTree(process);
                throw e;
            }
            if (!finished) {
                log.warn("Process {} exceeded timeout of {} ms, killing it",
                        spec.command().get(0), spec.timeout().toMillis());
                destroyTree(process);
                process.waitFor(1, TimeUnit.SECONDS);
            }

            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            return new ProcessOutcome(
                    finished ? process.exitValue() : -1,
                    await(stdout),
                    await(stderr),
                    !finished,
                    truncated.get(),
                    durationMs);
        } finally {
            tracker.untrack(process);
        }
    }

    /** Kill a process and everything it spawned. */
    public static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    // Bytes kept so far plus the reader filling them; the buffer outlives the reader.
    private record Capture(ByteArrayOutputStream kept, CompletableFuture<Void> reader) {}

    private static Capture drain(InputStream in, int cap, AtomicBoolean truncated) {
        ByteArrayOutputStream kept = new ByteArrayOutputStream();
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> {
            byte[] buf = new byte[8192];
            try (in) {
                int n;
                while ((n = in.read(buf)) != -1) {
                    int room = cap - kept.size();
                    if (room > 0) {
                        kept.write(buf, 0, Math.min(n, room));
                    }
                    if (n > room) {
                        truncated.set(true);
                    }
                }
            } catch (IOException e) {
                // Stream closed under us when the process was killed; keep what we have.
                log.debug("Output stream closed early: {}", e.getMessage());
            }
        }, READERS);
        return new Capture(kept, reader);
    }

    /**
     * Wait briefly for the reader, then return whatever it captured. A
     * grandchild holding the pipe open keeps the reader alive past the grace
     * period; its output so far is still returned.
     */
    private static String await(Capture capture) throws InterruptedException {
        try {
            capture.reader().get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Output reader did not finish cleanly: {}", e.toString());
        }
        return capture.kept().toString(StandardCharsets.UTF_8);
    }
}
