package com.scanpilot.orchestrator.service;

import java.util.List;

/**
 * A task as submitted, before validation and defaulting.
 *
 * @param provider    explicit provider tag; null to infer from the model name
 * @param strategy    comprehensive | quick | fast | deep | custom; null means comprehensive
 * @param depth       null means the strategy's default
 * @param scope       null means just the target
 * @param priority    low | medium | high | urgent; anything else means medium
 * @param scheduledAt epoch millis; null or past means now
 * @param verify      null means true
 */
public record TaskSubmission(
        String       name,
        String       target,
        String       model,
        String       provider,
        List<String> tools,
        String       strategy,
        Integer      depth,
        List<String> scope,
        List<String> excludeRules,
        String       userId,
        String       priority,
        Long         scheduledAt,
        Boolean      verify) {}
