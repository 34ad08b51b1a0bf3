package com.scanpilot.orchestrator.repository;

import com.scanpilot.orchestrator.model.LogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

/**
 * Append + read operations for the logs table.
 */
public interface LogEntryRepository extends JpaRepository<LogEntry, UUID> {

    List<LogEntry> findByJobIdOrderBySequenceAsc(UUID jobId);

    /** Newest first; the page size caps how many lines come back. */
    List<LogEntry> findByJobIdOrderBySequenceDesc(UUID jobId, Pageable page);

    @Modifying
    @Query("DELETE FROM LogEntry l WHERE l.jobId = :jobId")
    int deleteByJobId(UUID jobId);
}
