package com.scanpilot.orchestrator.repository;

import com.scanpilot.orchestrator.model.ExecutionRecord;
import com.scanpilot.orchestrator.model.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + listing queries for the executions table.
 */
public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, UUID> {

    /** Newest first; backs the task list endpoint. */
    List<ExecutionRecord> findAllByOrderByCreatedAtDesc();

    /** Backs the startup sweep for jobs left over from a previous process. */
    List<ExecutionRecord> findByStatusIn(Collection<ExecutionStatus> statuses);
}
