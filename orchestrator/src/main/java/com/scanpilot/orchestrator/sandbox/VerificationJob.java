package com.scanpilot.orchestrator.sandbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One piece of generated verification code to run against a target.
 *
 * @param id         fresh per run; names the sandbox directory and the code file
 * @param parameters ordered; values are passed positionally after the target
 * @param timeoutMs  0 or negative means the configured default
 */
public record VerificationJob(
        String              id,
        String              findingId,
        String              code,
        String              language,
        String              target,
        Map<String, String> parameters,
        long                timeoutMs,
        boolean             sandboxed) {

    public VerificationJob {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static VerificationJob of(String findingId, String code, String language,
                                     String target, Map<String, String> parameters, long timeoutMs) {
        return new VerificationJob(UUID.randomUUID().toString(), findingId, code, language,
                target, parameters, timeoutMs, true);
    }
}
