package com.scanpilot.orchestrator.queue;

import com.scanpilot.orchestrator.model.QueueState;
import com.scanpilot.orchestrator.model.QueuedJob;
import com.scanpilot.orchestrator.repository.QueuedJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link JobQueue} on the job_queue table. The DB is the queue: claiming is
 * SELECT ... FOR UPDATE SKIP LOCKED followed by an UPDATE to CLAIMED in the
 * same transaction, so two dispatchers never get the same entry.
 */
@Component
public class DatabaseJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(DatabaseJobQueue.class);

    private final QueuedJobRepository repo;
    private final TransactionTemplate tx;
    private final SchedulerProperties props;

    public DatabaseJobQueue(QueuedJobRepository repo,
                            PlatformTransactionManager txManager,
                            SchedulerProperties props) {
        this.repo  = repo;
        this.tx    = new TransactionTemplate(txManager);
        this.props = props;
    }

    @Override
    public void enqueue(UUID jobId, int priority, long notBefore) {
        inTransaction("enqueue", () -> repo.save(new QueuedJob(jobId, priority, notBefore, System.currentTimeMillis())));
        log.info("Enqueued job {} (priority={}, notBefore={})", jobId, priority, notBefore);
    }

    @Override
    public Optional<QueuedJob> claimNext(String workerId) {
        return inTransaction("claim", () -> {
            Optional<QueuedJob> opt = repo.claimNextReady(System.currentTimeMillis());
            opt.ifPresent(entry -> {
                entry.claim(workerId, System.currentTimeMillis());
                repo.save(entry);
                log.info("Worker '{}' claimed job {} (priority={}, attempt={})",
                        workerId, entry.getJobId(), entry.getPriority(), entry.getAttempts());
            });
            return opt;
        });
    }

    @Override
    public void acknowledge(UUID jobId) {
        inTransaction("acknowledge", () -> {
            repo.deleteById(jobId);
            return null;
        });
    }

    @Override
    public void retryLater(UUID jobId, String error, long retryAt) {
        inTransaction("retry", () -> {
            repo.findById(jobId).ifPresent(entry -> {
                entry.release(retryAt, error);
                repo.save(entry);
            });
            return null;
        });
    }

    @Override
    public void bury(UUID jobId, String error) {
        inTransaction("bury", () -> {
            repo.findById(jobId).ifPresent(entry -> {
                entry.bury(error);
                repo.save(entry);
            });
            return null;
        });
        log.error("Job {} moved to dead state: {}", jobId, error);
    }

    @Override
    public boolean contains(UUID jobId) {
        return inTransaction("lookup", () -> repo.existsById(jobId));
    }

    @Override
    public boolean remove(UUID jobId) {
        return inTransaction("remove", () -> {
            if (!repo.existsById(jobId)) {
                return false;
            }
            repo.deleteById(jobId);
            return true;
        });
    }

    @Override
    public List<QueuedJob> staleClaims(long cutoff) {
        return inTransaction("stale claims",
                () -> repo.findByStateAndClaimedAtBefore(QueueState.CLAIMED, cutoff));
    }

    @Override
    public QueueStats stats() {
        return inTransaction("stats", () -> {
            long now = System.currentTimeMillis();
            return new QueueStats(true,
                    repo.countByStateAndNotBeforeLessThanEqual(QueueState.READY, now),
                    repo.countByStateAndNotBeforeGreaterThan(QueueState.READY, now),
                    repo.countByState(QueueState.CLAIMED),
                    repo.countByState(QueueState.DEAD),
                    0, 0);
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> T inTransaction(String what, Supplier<T> op) {
        if (!props.isQueueEnabled()) {
            throw new QueueUnavailableException("Job queue is disabled");
        }
        try {
            return tx.execute(status -> op.get());
        } catch (DataAccessException | TransactionException e) {
            throw new QueueUnavailableException("Job queue " + what + " failed: " + e.getMessage(), e);
        }
    }
}
