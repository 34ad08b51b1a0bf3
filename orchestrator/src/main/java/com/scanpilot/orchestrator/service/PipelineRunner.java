package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.ai.AiService;
import com.scanpilot.orchestrator.ai.AiSession;
import com.scanpilot.orchestrator.chain.ChainExecutionException;
import com.scanpilot.orchestrator.chain.ChainExecutor;
import com.scanpilot.orchestrator.chain.ChainListener;
import com.scanpilot.orchestrator.chain.ChainRequest;
import com.scanpilot.orchestrator.chain.ChainResult;
import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.LogLevel;
import com.scanpilot.orchestrator.model.PipelineStage;
import com.scanpilot.orchestrator.model.TaskDefinition;
import com.scanpilot.orchestrator.persistence.PersistenceException;
import com.scanpilot.orchestrator.persistence.PersistenceGateway;
import com.scanpilot.orchestrator.report.ReportArtifact;
import com.scanpilot.orchestrator.report.ReportAssembler;
import com.scanpilot.orchestrator.report.ReportDocument;
import com.scanpilot.orchestrator.report.ReportFormat;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one job through the assessment pipeline.
 *
 * <pre>
 *   INIT             initialise the AI session                 → 10
 *   CHAIN_EXECUTION  run the analysis chain, collect findings  → 60
 *   VERIFICATION     check each finding in the sandbox         → 80
 *   REPORT_ASSEMBLY  write the report, mark completed          → 100
 * </pre>
 *
 * Stages run strictly in order; each ends with one atomic record write and
 * a log line, then a boundary where pause blocks and cancel unwinds.
 *
 * This is the single entry point for both the queue dispatcher and the
 * inline fallback. Running a job that is no longer pending does nothing.
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final ExecutionTracker   tracker;
    private final PersistenceGateway gateway;
    private final AiService          ai;
    private final ChainExecutor      chain;
    private final FindingVerifier    verifier;
    private final ReportAssembler    reports;
    private final MeterRegistry      meterRegistry;

    public PipelineRunner(ExecutionTracker tracker,
                          PersistenceGateway gateway,
                          AiService ai,
                          ChainExecutor chain,
                          FindingVerifier verifier,
                          ReportAssembler reports,
                          MeterRegistry meterRegistry) {
        this.tracker       = tracker;
        this.gateway       = gateway;
        this.ai            = ai;
        this.chain         = chain;
        this.verifier      = verifier;
        this.reports       = reports;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run the job if it is still pending.
     *
     * A stage failure marks the job failed and is then rethrown so the
     * dispatcher can see it. Cancellation returns normally.
     */
    public void run(UUID jobId) {
        MDC.put("jobId", jobId.toString());
        try {
            ExecutionSnapshot snapshot = tracker.snapshot(jobId).orElse(null);
            if (snapshot == null) {
                log.warn("Job {} has no execution record, nothing to run", jobId);
                return;
            }
            if (snapshot.status() != ExecutionStatus.PENDING) {
                log.info("Job {} is {}, skipping", jobId, snapshot.status().wireName());
                return;
            }
            MDC.put("taskId", snapshot.taskId());
            TaskDefinition task = gateway.findTask(snapshot.taskId())
                    .orElseThrow(() -> new IllegalStateException("Task " + snapshot.taskId() + " not found"));

            JobControl control = tracker.attach(jobId);
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "completed";
            try {
                if (!tracker.start(jobId)) {
                    outcome = "skipped";
                    return;
                }
                execute(jobId, task, control);
                log.info("Job {} completed", jobId);
            } catch (JobCancelledException e) {
                outcome = "cancelled";
                log.info("Job {} stopped after cancellation", jobId);
            } catch (RuntimeException e) {
                outcome = "failed";
                log.error("Job {} failed: {}", jobId, e.getMessage(), e);
                recordFailure(jobId, e);
                throw e;
            } finally {
                tracker.detach(jobId);
                if (!"skipped".equals(outcome)) {
                    sample.stop(meterRegistry.timer("scanpilot.job.duration", "outcome", outcome));
                    meterRegistry.counter("scanpilot.jobs", "outcome", outcome).increment();
                }
            }
        } finally {
            MDC.remove("jobId");
            MDC.remove("taskId");
            MDC.remove("stage");
        }
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    private void execute(UUID jobId, TaskDefinition task, JobControl control) {
        // 1. AI session for the selected provider/model
        stage(PipelineStage.INIT);
        AiSession session = ai.initialize(task.getModelSelection());
        tracker.checkpoint(jobId, PipelineStage.INIT, null,
                "AI service initialised (" + session.selection().provider() + "/" + session.selection().model() + ")");
        control.awaitBoundary();

        // 2. Analysis chain
        stage(PipelineStage.CHAIN_EXECUTION);
        ChainResult result = chain.execute(new ChainRequest(task.getId(), task.getTarget(), session,
                task.getTools(), task.getStrategy(), task.getDepth(), task.getScope(), task.getExcludeRules(),
                control, listenerFor(jobId, control)));
        control.throwIfCancelled();
        if (!result.success()) {
            throw new ChainExecutionException("Chain execution failed: " + result.error());
        }
        tracker.checkpoint(jobId, PipelineStage.CHAIN_EXECUTION, result.findings(),
                "Chain finished with " + result.findings().size() + " finding(s)");
        control.awaitBoundary();

        // 3. Sandbox verification
        stage(PipelineStage.VERIFICATION);
        List<Finding> findings = result.findings();
        if (task.isVerify()) {
            List<Finding> checked = new ArrayList<>(findings.size());
            for (Finding f : findings) {
                control.throwIfCancelled();
                checked.add(verifier.verify(f, task.getTarget(), control));
            }
            findings = checked;
        }
        long confirmed = findings.stream().filter(Finding::verified).count();
        tracker.checkpoint(jobId, PipelineStage.VERIFICATION, findings,
                task.isVerify()
                        ? "Verification finished: " + confirmed + " of " + findings.size() + " confirmed"
                        : "Verification skipped");
        control.awaitBoundary();

        // 4. Report
        stage(PipelineStage.REPORT_ASSEMBLY);
        ExecutionSnapshot current = tracker.snapshot(jobId).orElseThrow();
        long now = System.currentTimeMillis();
        ReportArtifact artifact = reports.assemble(ReportDocument.of(
                new ReportDocument.TaskInfo(task.getId(), jobId.toString(), task.getName(), task.getTarget(),
                        "completed", current.startedAt(), now,
                        current.startedAt() == null ? 0 : now - current.startedAt()),
                findings, now), ReportFormat.HTML);
        control.awaitBoundary();
        // A pause can still land between the boundary and the write.
        while (!tracker.complete(jobId, artifact.path())) {
            control.awaitBoundary();
        }
    }

    private ChainListener listenerFor(UUID jobId, JobControl control) {
        return new ChainListener() {
            @Override
            public void log(LogLevel level, String message) {
                tracker.appendLog(jobId, level, message);
            }

            @Override
            public boolean stopRequested() {
                return control.isCancelled();
            }
        };
    }

    private void recordFailure(UUID jobId, RuntimeException cause) {
        try {
            tracker.fail(jobId, cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
        } catch (PersistenceException e) {
            log.error("Could not record failure of job {}: {}", jobId, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private static void stage(PipelineStage stage) {
        MDC.put("stage", stage.name());
    }
}
