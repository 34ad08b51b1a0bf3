package com.scanpilot.orchestrator.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanpilot.orchestrator.model.ExecutionRecord;
import com.scanpilot.orchestrator.model.ExecutionStatus;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.LogEntry;
import com.scanpilot.orchestrator.model.TaskDefinition;
import com.scanpilot.orchestrator.repository.ExecutionRecordRepository;
import com.scanpilot.orchestrator.repository.LogEntryRepository;
import com.scanpilot.orchestrator.repository.TaskDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Single entry point for durable state: task definitions, execution records
 * and job log lines.
 *
 * Every operation is retried on {@link DataAccessException} (or a failure to
 * open a transaction) with exponential
 * backoff; once the budget is spent a {@link PersistenceException} is thrown.
 * Findings travel as a JSON array in the record's findings column and are
 * (de)serialised here so nothing above this layer sees raw JSON.
 */
@Component
public class PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(PersistenceGateway.class);

    private static final TypeReference<List<Finding>> FINDINGS_TYPE = new TypeReference<>() {};

    private final TaskDefinitionRepository  taskRepo;
    private final ExecutionRecordRepository executionRepo;
    private final LogEntryRepository        logRepo;
    private final TransactionTemplate       tx;
    private final ObjectMapper              mapper;
    private final PersistenceProperties     props;

    public PersistenceGateway(TaskDefinitionRepository taskRepo,
                              ExecutionRecordRepository executionRepo,
                              LogEntryRepository logRepo,
                              PlatformTransactionManager txManager,
                              ObjectMapper mapper,
                              PersistenceProperties props) {
        this.taskRepo      = taskRepo;
        this.executionRepo = executionRepo;
        this.logRepo       = logRepo;
        this.tx            = new TransactionTemplate(txManager);
        this.mapper        = mapper;
        this.props         = props;
    }

    // ------------------------------------------------------------------
    // Tasks
    // ------------------------------------------------------------------

    public TaskDefinition saveTask(TaskDefinition task) {
        return withRetry("save task " + task.getId(), () -> taskRepo.save(task));
    }

    public Optional<TaskDefinition> findTask(String taskId) {
        return withRetry("load task " + taskId, () -> taskRepo.findById(taskId));
    }

    // ------------------------------------------------------------------
    // Execution records
    // ------------------------------------------------------------------

    /** Write the whole row: status, progress, stage and timestamps land in one UPDATE. */
    public ExecutionRecord saveExecution(ExecutionRecord record) {
        return withRetry("save execution " + record.getJobId(), () -> executionRepo.save(record));
    }

    public Optional<ExecutionRecord> findExecution(UUID jobId) {
        return withRetry("load execution " + jobId, () -> executionRepo.findById(jobId));
    }

    public List<ExecutionRecord> findAllExecutions() {
        return withRetry("list executions", executionRepo::findAllByOrderByCreatedAtDesc);
    }

    public List<ExecutionRecord> findExecutionsByStatus(Collection<ExecutionStatus> statuses) {
        return withRetry("list executions by status", () -> executionRepo.findByStatusIn(statuses));
    }

    // ------------------------------------------------------------------
    // Logs
    // ------------------------------------------------------------------

    public void appendLog(LogEntry entry) {
        withRetry("append log " + entry.getJobId() + "#" + entry.getSequence(),
                () -> logRepo.save(entry));
    }

    public List<LogEntry> logs(UUID jobId) {
        return withRetry("load logs " + jobId, () -> logRepo.findByJobIdOrderBySequenceAsc(jobId));
    }

    /** The newest {@code limit} log lines of a job, oldest first. */
    public List<LogEntry> recentLogs(UUID jobId, int limit) {
        return withRetry("load recent logs " + jobId, () -> {
            List<LogEntry> newest = new ArrayList<>(
                    logRepo.findByJobIdOrderBySequenceDesc(jobId, PageRequest.of(0, Math.max(1, limit))));
            Collections.reverse(newest);
            return newest;
        });
    }

    /** Remove an execution record together with all of its log lines. */
    public void deleteJob(UUID jobId) {
        withRetry("delete job " + jobId, () -> tx.execute(status -> {
            int removed = logRepo.deleteByJobId(jobId);
            executionRepo.deleteById(jobId);
            log.info("Deleted job {} ({} log lines)", jobId, removed);
            return null;
        }));
    }

    // ------------------------------------------------------------------
    // Findings column
    // ------------------------------------------------------------------

    public String encodeFindings(List<Finding> findings) {
        try {
            return mapper.writeValueAsString(findings);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialise findings", e);
        }
    }

    public List<Finding> decodeFindings(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(mapper.readValue(json, FINDINGS_TYPE));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt findings column", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> T withRetry(String what, Supplier<T> op) {
        int maxAttempts = Math.max(1, props.getMaxAttempts());
        long backoff = props.getInitialBackoffMs();
        for (int attempt = 1; ; attempt++) {
            try {
                return op.get();
            } catch (DataAccessException | TransactionException e) {
                if (attempt >= maxAttempts) {
                    log.error("Persistence operation '{}' failed after {} attempts", what, attempt, e);
                    throw new PersistenceException(
                            "Persistence operation '" + what + "' failed after " + attempt + " attempts", e);
                }
                log.warn("Persistence operation '{}' failed (attempt {}/{}), retrying in {} ms: {}",
                        what, attempt, maxAttempts, backoff, e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new PersistenceException("Interrupted while retrying '" + what + "'", ie);
                }
                backoff *= 2;
            }
        }
    }
}
