package com.scanpilot.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scanpilot.orchestrator.service.TaskSubmission;
import com.scanpilot.orchestrator.service.ValidationException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Request body for POST /api/tasks.
 *
 * Required: name, target, ai_model
 * Optional: everything else. scheduled_time is an ISO-8601 instant, e.g.
 *   "2026-01-01T08:00:00Z"; a time in the past means "now".
 */
public record SubmitTaskRequest(
        String       name,
        String       target,
        @JsonProperty("ai_model")       String       aiModel,
        String       provider,
        List<String> tools,
        String       strategy,
        Integer      depth,
        List<String> scope,
        @JsonProperty("exclude_rules")  List<String> excludeRules,
        @JsonProperty("user_id")        String       userId,
        String       priority,
        @JsonProperty("scheduled_time") String       scheduledTime,
        Boolean      verify) {

    public TaskSubmission toSubmission() {
        return new TaskSubmission(name, target, aiModel, provider, tools, strategy, depth,
                scope, excludeRules, userId, priority, parseScheduledTime(), verify);
    }

    private Long parseScheduledTime() {
        if (scheduledTime == null || scheduledTime.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(scheduledTime.trim()).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new ValidationException("scheduled_time is not an ISO-8601 instant: " + scheduledTime);
        }
    }
}
