package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.ai.AiService;
import com.scanpilot.orchestrator.ai.AiServiceException;
import com.scanpilot.orchestrator.ai.AiSession;
import com.scanpilot.orchestrator.chain.ChainExecutionException;
import com.scanpilot.orchestrator.chain.ChainExecutor;
import com.scanpilot.orchestrator.chain.ChainRequest;
import com.scanpilot.orchestrator.chain.ChainResult;
import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.ModelSelection;
import com.scanpilot.orchestrator.model.Severity;
import com.scanpilot.orchestrator.model.Strategy;
import com.scanpilot.orchestrator.model.TaskDefinition;
import com.scanpilot.orchestrator.report.ReportArtifact;
import com.scanpilot.orchestrator.report.ReportAssembler;
import com.scanpilot.orchestrator.report.ReportDocument;
import com.scanpilot.orchestrator.report.ReportFormat;
import com.scanpilot.orchestrator.sandbox.VerificationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PipelineRunner.
 *
 * The tracker is real over an in-memory gateway; AI, chain, verifier and
 * report assembly are mocks.
 */
@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    @Mock AiService       ai;
    @Mock ChainExecutor   chain;
    @Mock FindingVerifier verifier;
    @Mock ReportAssembler reports;

    InMemoryPersistenceGateway gateway;
    ExecutionTracker           tracker;
    SimpleMeterRegistry        meters;
    PipelineRunner             runner;

    UUID jobId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        gateway = new InMemoryPersistenceGateway();
        tracker = new ExecutionTracker(gateway);
        meters  = new SimpleMeterRegistry();
        runner  = new PipelineRunner(tracker, gateway, ai, chain, verifier, reports, meters);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void run_pendingJob_goesThroughEveryStageToCompleted() {
        TaskDefinition task = submit(true);
        Finding raw = finding("finding_1");
        Finding checked = raw.withVerification(new VerificationResult(true, true, "[+] yes", null, 50, 80));
        when(ai.initialize(task.getModelSelection())).thenReturn(session(task));
        when(chain.execute(any())).thenReturn(ChainResult.ok(List.of(raw), List.of()));
        when(verifier.verify(eq(raw), eq("10.0.0.5"), any())).thenReturn(checked);
        when(reports.assemble(any(), eq(ReportFormat.HTML)))
                .thenReturn(new ReportArtifact("report_" + jobId, ReportFormat.HTML, "/reports/r.html", 1L));

        runner.run(jobId);

        ExecutionSnapshot s = tracker.snapshot(jobId).orElseThrow();
        assertThat(s.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(s.progress()).isEqualTo(100);
        assertThat(s.reportRef()).isEqualTo("/reports/r.html");
        assertThat(s.findings()).containsExactly(checked);
        assertThat(s.completedAt()).isNotNull();
        assertThat(gateway.progressHistory(jobId)).containsSubsequence(0, 10, 60, 80, 100);
        assertThat(tracker.isAttached(jobId)).isFalse();
        assertThat(meters.counter("scanpilot.jobs", "outcome", "completed").count()).isEqualTo(1.0);

        ArgumentCaptor<ReportDocument> doc = ArgumentCaptor.forClass(ReportDocument.class);
        verify(reports).assemble(doc.capture(), eq(ReportFormat.HTML));
        assertThat(doc.getValue().summary().verified()).isEqualTo(1);
        assertThat(doc.getValue().taskInfo().target()).isEqualTo("10.0.0.5");
    }

    @Test
    void run_chainRequestCarriesTaskSettings() {
        TaskDefinition task = submit(false);
        when(ai.initialize(any())).thenReturn(session(task));
        when(chain.execute(any())).thenReturn(ChainResult.ok(List.of(), List.of()));
        when(reports.assemble(any(), any()))
                .thenReturn(new ReportArtifact("r", ReportFormat.HTML, "/reports/r.html", 1L));

        runner.run(jobId);

        ArgumentCaptor<ChainRequest> req = ArgumentCaptor.forClass(ChainRequest.class);
        verify(chain).execute(req.capture());
        assertThat(req.getValue().tools()).containsExactly("nmap", "dirb");
        assertThat(req.getValue().strategy()).isEqualTo(Strategy.DEEP);
        assertThat(req.getValue().depth()).isEqualTo(3);
        assertThat(req.getValue().target()).isEqualTo("10.0.0.5");
    }

    @Test
    void run_verifyDisabled_skipsSandbox() {
        TaskDefinition task = submit(false);
        when(ai.initialize(any())).thenReturn(session(task));
        when(chain.execute(any())).thenReturn(ChainResult.ok(List.of(finding("finding_1")), List.of()));
        when(reports.assemble(any(), any()))
                .thenReturn(new ReportArtifact("r", ReportFormat.HTML, "/reports/r.html", 1L));

        runner.run(jobId);

        verifyNoInteractions(verifier);
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.COMPLETED);
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void run_chainFails_recordsFailureAndRethrows() {
        TaskDefinition task = submit(true);
        when(ai.initialize(any())).thenReturn(session(task));
        when(chain.execute(any())).thenReturn(ChainResult.failed("all tools failed", List.of()));

        assertThatThrownBy(() -> runner.run(jobId))
                .isInstanceOf(ChainExecutionException.class)
                .hasMessageContaining("all tools failed");

        ExecutionSnapshot s = tracker.snapshot(jobId).orElseThrow();
        assertThat(s.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(s.progress()).isEqualTo(10);
        assertThat(s.error()).contains("all tools failed");
        assertThat(s.logs()).extracting(LogLine::message).anyMatch(m -> m.startsWith("Task failed"));
        verifyNoInteractions(reports);
        assertThat(meters.counter("scanpilot.jobs", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void run_aiInitFails_recordsFailure() {
        submit(true);
        when(ai.initialize(any())).thenThrow(new AiServiceException("no key"));

        assertThatThrownBy(() -> runner.run(jobId)).isInstanceOf(AiServiceException.class);

        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.FAILED);
        verifyNoInteractions(chain);
    }

    // ------------------------------------------------------------------
    // Cancellation and skips
    // ------------------------------------------------------------------

    @Test
    void run_cancelledDuringChain_stopsWithoutReport() {
        TaskDefinition task = submit(true);
        when(ai.initialize(any())).thenReturn(session(task));
        when(chain.execute(any())).thenAnswer(inv -> {
            tracker.cancel(jobId);
            return ChainResult.ok(List.of(finding("finding_1")), List.of());
        });

        runner.run(jobId);

        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.CANCELLED);
        verifyNoInteractions(verifier, reports);
        assertThat(meters.counter("scanpilot.jobs", "outcome", "cancelled").count()).isEqualTo(1.0);
    }

    @Test
    void run_pausedDuringReport_waitsForResumeBeforeCompleting() {
        TaskDefinition task = submit(false);
        when(ai.initialize(any())).thenReturn(session(task));
        when(chain.execute(any())).thenReturn(ChainResult.ok(List.of(), List.of()));
        when(reports.assemble(any(), any())).thenAnswer(inv -> {
            assertThat(tracker.pause(jobId)).isTrue();
            Thread resumer = new Thread(() -> {
                try {
                    Thread.sleep(200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                tracker.resume(jobId);
            });
            resumer.start();
            return new ReportArtifact("r", ReportFormat.HTML, "/reports/r.html", 1L);
        });

        runner.run(jobId);

        List<ExecutionStatus> history = gateway.statusHistory(jobId);
        assertThat(history).containsSubsequence(
                ExecutionStatus.PAUSED, ExecutionStatus.RUNNING, ExecutionStatus.COMPLETED);
        assertThat(history.get(history.size() - 2)).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.COMPLETED);
    }

    @Test
    void run_jobNotPending_doesNothing() {
        submit(true);
        tracker.cancel(jobId);

        runner.run(jobId);

        verifyNoInteractions(ai, chain, verifier, reports);
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.CANCELLED);
    }

    @Test
    void run_unknownJob_doesNothing() {
        runner.run(UUID.randomUUID());

        verifyNoInteractions(ai, chain, verifier, reports);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TaskDefinition submit(boolean verify) {
        TaskDefinition task = new TaskDefinition("task_1", "staging", "10.0.0.5",
                ModelSelection.of(null, "gpt-4"), List.of("nmap", "dirb"), Strategy.DEEP, 3,
                List.of("10.0.0.5"), List.of(), "alice", 3, null, verify, 1_000L);
        gateway.saveTask(task);
        tracker.register(jobId, task.getId());
        return task;
    }

    private static AiSession session(TaskDefinition task) {
        return new AiSession(task.getModelSelection(), null, 0.3, 2048);
    }

    private static Finding finding(String id) {
        return Finding.unverified(id, "open_port", "Open port 80/tcp", "http", Severity.INFO, "80/tcp");
    }
}
