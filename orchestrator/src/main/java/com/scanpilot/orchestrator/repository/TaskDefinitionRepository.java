package com.scanpilot.orchestrator.repository;

import com.scanpilot.orchestrator.model.TaskDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD operations for the tasks table.
 */
public interface TaskDefinitionRepository extends JpaRepository<TaskDefinition, String> {
}
