package com.scanpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scanpilot.orchestrator.sandbox.VerificationResult;

/**
 * A candidate security issue produced by the chain.
 *
 * {@code verified} is only ever set from a sandbox run whose output matched a
 * positive indicator; see {@link VerificationResult#reliabilityScore()} for
 * how much weight that deserves.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
        String             id,
        String             type,
        String             title,
        String             description,
        Severity           severity,
        String             component,
        String             cveId,
        boolean            verified,
        VerificationResult verification) {

    public static Finding unverified(String id, String type, String title,
                                     String description, Severity severity, String component) {
        return new Finding(id, type, title, description, severity, component, null, false, null);
    }

    /** Merge a sandbox result into this finding. */
    public Finding withVerification(VerificationResult result) {
        boolean confirmed = result != null && result.confirmed();
        return new Finding(id, type, title, description, severity, component, cveId, confirmed, result);
    }
}
