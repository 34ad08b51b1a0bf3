package com.scanpilot.orchestrator.repository;

import com.scanpilot.orchestrator.model.QueueState;
import com.scanpilot.orchestrator.model.QueuedJob;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + dispatcher queries for the job_queue table.
 */
public interface QueuedJobRepository extends JpaRepository<QueuedJob, UUID> {

    /**
     * Claim the most urgent READY entry whose backoff has elapsed.
     *
     * Lock timeout -2 makes Hibernate emit FOR UPDATE SKIP LOCKED, so
     * concurrent dispatchers never block on or double-claim the same row.
     * Must run inside a transaction that flips the entry to CLAIMED.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT q FROM QueuedJob q
            WHERE q.state = com.scanpilot.orchestrator.model.QueueState.READY
              AND q.notBefore <= :now
            ORDER BY q.priority DESC, q.notBefore ASC
            LIMIT 1
            """)
    Optional<QueuedJob> claimNextReady(long now);

    long countByState(QueueState state);

    long countByStateAndNotBeforeLessThanEqual(QueueState state, long now);

    long countByStateAndNotBeforeGreaterThan(QueueState state, long now);

    /** CLAIMED entries whose worker has not acknowledged them since {@code cutoff}. */
    List<QueuedJob> findByStateAndClaimedAtBefore(QueueState state, long cutoff);
}
