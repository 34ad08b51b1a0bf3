package com.scanpilot.orchestrator.chain;

import com.scanpilot.orchestrator.model.Finding;

import java.util.Optional;

/**
 * Produces code that checks whether a finding is real.
 * Empty when the finding's type cannot be verified automatically.
 */
public interface VerificationCodeGenerator {

    Optional<GeneratedCode> generate(Finding finding, String target);
}
