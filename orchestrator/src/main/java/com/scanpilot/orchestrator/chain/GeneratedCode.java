package com.scanpilot.orchestrator.chain;

import java.util.Map;

/**
 * Verification code for one finding.
 *
 * @param parameters passed to the code after the target, in order
 */
public record GeneratedCode(String code, String language, String description, Map<String, String> parameters) {}
