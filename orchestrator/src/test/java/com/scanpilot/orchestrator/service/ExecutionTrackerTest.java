package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.model.ExecutionRecord;
import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.LogEntry;
import com.scanpilot.orchestrator.model.LogLevel;
import com.scanpilot.orchestrator.model.PipelineStage;
import com.scanpilot.orchestrator.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ExecutionTracker.
 *
 * Backed by an in-memory gateway, so every write can be inspected in the
 * order it happened.
 */
class ExecutionTrackerTest {

    InMemoryPersistenceGateway gateway;
    ExecutionTracker           tracker;

    UUID jobId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        gateway = new InMemoryPersistenceGateway();
        tracker = new ExecutionTracker(gateway);
    }

    // ------------------------------------------------------------------
    // register / start
    // ------------------------------------------------------------------

    @Test
    void register_writesPendingRecordAndFirstLogLine() {
        ExecutionSnapshot s = tracker.register(jobId, "task_1");

        assertThat(s.status()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(s.progress()).isZero();
        assertThat(gateway.executions.get(jobId).getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(gateway.logs(jobId)).extracting(LogEntry::getMessage).containsExactly("Task created");
        assertThat(gateway.logs(jobId).get(0).getSequence()).isEqualTo(1);
    }

    @Test
    void start_pendingJob_movesToRunning() {
        tracker.register(jobId, "task_1");

        assertThat(tracker.start(jobId)).isTrue();

        ExecutionSnapshot s = tracker.snapshot(jobId).orElseThrow();
        assertThat(s.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(s.startedAt()).isNotNull();
        assertThat(s.currentStage()).isEqualTo(PipelineStage.STARTING_LABEL);
    }

    @Test
    void start_cancelledJob_returnsFalse() {
        tracker.register(jobId, "task_1");
        tracker.cancel(jobId);

        assertThat(tracker.start(jobId)).isFalse();
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.CANCELLED);
    }

    // ------------------------------------------------------------------
    // checkpoints
    // ------------------------------------------------------------------

    @Test
    void checkpoints_progressNeverDecreases() {
        tracker.register(jobId, "task_1");
        tracker.attach(jobId);
        tracker.start(jobId);

        tracker.checkpoint(jobId, PipelineStage.INIT, null, "init");
        tracker.checkpoint(jobId, PipelineStage.CHAIN_EXECUTION, List.of(finding("f1")), "chain");
        tracker.checkpoint(jobId, PipelineStage.INIT, null, "init again");
        tracker.checkpoint(jobId, PipelineStage.VERIFICATION, null, "verify");
        tracker.complete(jobId, "/reports/r.html");

        List<Integer> history = gateway.progressHistory(jobId);
        assertThat(history).isSortedAccordingTo(Integer::compare);
        assertThat(history).contains(10, 60, 80, 100);
        assertThat(tracker.snapshot(jobId).orElseThrow().progress()).isEqualTo(100);
    }

    @Test
    void checkpoint_withFindings_landsInSameWrite() {
        tracker.register(jobId, "task_1");
        tracker.start(jobId);

        tracker.checkpoint(jobId, PipelineStage.CHAIN_EXECUTION, List.of(finding("f1"), finding("f2")), "chain");

        ExecutionRecord last = gateway.writes.get(gateway.writes.size() - 1);
        assertThat(last.getProgress()).isEqualTo(60);
        assertThat(gateway.decodeFindings(last.getFindings())).extracting(Finding::id).containsExactly("f1", "f2");
    }

    @Test
    void checkpoint_afterCancel_throwsJobCancelled() {
        tracker.register(jobId, "task_1");
        tracker.start(jobId);
        tracker.cancel(jobId);

        assertThatThrownBy(() -> tracker.checkpoint(jobId, PipelineStage.INIT, null, "init"))
                .isInstanceOf(JobCancelledException.class);
    }

    // ------------------------------------------------------------------
    // pause / resume / cancel
    // ------------------------------------------------------------------

    @Test
    void pauseThenResume_keepsFindingsAndLogs() {
        tracker.register(jobId, "task_1");
        tracker.attach(jobId);
        tracker.start(jobId);
        tracker.checkpoint(jobId, PipelineStage.CHAIN_EXECUTION, List.of(finding("f1")), "chain done");
        int logsBefore = tracker.snapshot(jobId).orElseThrow().logs().size();

        assertThat(tracker.pause(jobId)).isTrue();
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.PAUSED);
        assertThat(tracker.resume(jobId)).isTrue();

        ExecutionSnapshot s = tracker.snapshot(jobId).orElseThrow();
        assertThat(s.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(s.progress()).isEqualTo(60);
        assertThat(s.findings()).extracting(Finding::id).containsExactly("f1");
        assertThat(s.logs()).hasSize(logsBefore + 2);
        assertThat(s.logs().subList(0, logsBefore)).extracting(LogLine::message)
                .containsExactly("Task created", "Task started", "chain done");
    }

    @Test
    void pause_jobWithoutWorker_returnsFalse() {
        tracker.register(jobId, "task_1");
        tracker.start(jobId);

        assertThat(tracker.pause(jobId)).isFalse();
    }

    @Test
    void cancel_terminalJob_returnsFalse() {
        tracker.register(jobId, "task_1");
        tracker.start(jobId);
        tracker.fail(jobId, "boom");

        assertThat(tracker.cancel(jobId)).isFalse();
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.FAILED);
    }

    @Test
    void cancel_attachedJob_signalsTheWorker() {
        tracker.register(jobId, "task_1");
        JobControl control = tracker.attach(jobId);
        tracker.start(jobId);

        assertThat(tracker.cancel(jobId)).isTrue();

        assertThat(control.isCancelled()).isTrue();
        assertThat(gateway.logs(jobId)).extracting(LogEntry::getLevel).contains(LogLevel.WARN);
    }

    @Test
    void cancel_unknownJob_throwsNotFound() {
        assertThatThrownBy(() -> tracker.cancel(UUID.randomUUID()))
                .isInstanceOf(JobNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // crash recovery
    // ------------------------------------------------------------------

    @Test
    void snapshot_notInMemory_isRebuiltFromPersistedRecord() {
        List<Finding> findings = List.of(finding("f1"));
        gateway.saveExecution(new ExecutionRecord(jobId, "task_1", ExecutionStatus.RUNNING, 40,
                "finding verification", 1_000L, 1_500L, null, gateway.encodeFindings(findings), null, null));
        gateway.appendLog(new LogEntry(jobId, 1, LogLevel.INFO, "Task created", 1_000L));
        gateway.appendLog(new LogEntry(jobId, 2, LogLevel.INFO, "Task started", 1_500L));

        ExecutionTracker fresh = new ExecutionTracker(gateway);
        ExecutionSnapshot s = fresh.snapshot(jobId).orElseThrow();

        assertThat(s.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(s.progress()).isEqualTo(40);
        assertThat(s.findings()).extracting(Finding::id).containsExactly("f1");
        assertThat(s.logs()).extracting(LogLine::message).containsExactly("Task created", "Task started");
        assertThat(fresh.isTracked(jobId)).isFalse();
    }

    @Test
    void appendLog_afterRecovery_continuesSequence() {
        gateway.saveExecution(new ExecutionRecord(jobId, "task_1", ExecutionStatus.RUNNING, 40,
                "finding verification", 1_000L, 1_500L, null, "[]", null, null));
        gateway.appendLog(new LogEntry(jobId, 7, LogLevel.INFO, "earlier", 1_000L));

        tracker.appendLog(jobId, LogLevel.INFO, "later");

        assertThat(gateway.logs(jobId)).extracting(LogEntry::getSequence).containsExactly(7L, 8L);
    }

    @Test
    void all_persistedJob_loadsOnlyNewestLogLines() {
        gateway.saveExecution(new ExecutionRecord(jobId, "task_1", ExecutionStatus.COMPLETED, 100,
                "completed", 1_000L, 1_500L, 2_000L, "[]", "/r.html", null));
        for (int i = 1; i <= 15; i++) {
            gateway.appendLog(new LogEntry(jobId, i, LogLevel.INFO, "line " + i, 1_000L + i));
        }

        List<ExecutionSnapshot> all = tracker.all(10);

        assertThat(all).hasSize(1);
        assertThat(all.get(0).logs()).extracting(LogLine::sequence)
                .containsExactly(6L, 7L, 8L, 9L, 10L, 11L, 12L, 13L, 14L, 15L);
        assertThat(gateway.fullLogReads.get()).isZero();
        assertThat(tracker.isTracked(jobId)).isFalse();
    }

    // ------------------------------------------------------------------
    // delete / eviction
    // ------------------------------------------------------------------

    @Test
    void delete_finishedJob_removesRecordAndLogs() {
        tracker.register(jobId, "task_1");
        tracker.cancel(jobId);

        assertThat(tracker.delete(jobId)).isTrue();

        assertThat(gateway.executions).doesNotContainKey(jobId);
        assertThat(gateway.logs(jobId)).isEmpty();
        assertThat(tracker.snapshot(jobId)).isEmpty();
    }

    @Test
    void delete_runningJob_returnsFalse() {
        tracker.register(jobId, "task_1");
        tracker.start(jobId);

        assertThat(tracker.delete(jobId)).isFalse();
        assertThat(gateway.executions).containsKey(jobId);
    }

    @Test
    void complete_pausedJob_returnsFalseUntilResumed() {
        tracker.register(jobId, "task_1");
        tracker.attach(jobId);
        tracker.start(jobId);
        tracker.pause(jobId);

        assertThat(tracker.complete(jobId, "/r.html")).isFalse();
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.PAUSED);

        tracker.resume(jobId);
        assertThat(tracker.complete(jobId, "/r.html")).isTrue();
        assertThat(gateway.statusHistory(jobId)).doesNotContainSequence(ExecutionStatus.PAUSED, ExecutionStatus.COMPLETED);
    }

    @Test
    void complete_pendingJob_rejectedByTransitionTable() {
        tracker.register(jobId, "task_1");

        assertThatThrownBy(() -> tracker.complete(jobId, "/r.html"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("pending");
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.PENDING);
    }

    @Test
    void detach_evictsTerminalSnapshot() {
        tracker.register(jobId, "task_1");
        tracker.attach(jobId);
        tracker.start(jobId);
        tracker.complete(jobId, "/r.html");
        assertThat(tracker.isTracked(jobId)).isTrue();

        tracker.detach(jobId);

        assertThat(tracker.isTracked(jobId)).isFalse();
        assertThat(tracker.statusOf(jobId)).contains(ExecutionStatus.COMPLETED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Finding finding(String id) {
        return Finding.unverified(id, "open_port", "Open port 80/tcp", "http", Severity.INFO, "80/tcp");
    }
}
