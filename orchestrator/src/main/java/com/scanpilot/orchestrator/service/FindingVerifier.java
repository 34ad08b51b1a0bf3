package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.chain.GeneratedCode;
import com.scanpilot.orchestrator.chain.VerificationCodeGenerator;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.process.ProcessTracker;
import com.scanpilot.orchestrator.sandbox.SandboxExecutionException;
import com.scanpilot.orchestrator.sandbox.UnsupportedLanguageException;
import com.scanpilot.orchestrator.sandbox.VerificationJob;
import com.scanpilot.orchestrator.sandbox.VerificationResult;
import com.scanpilot.orchestrator.sandbox.VerificationSandbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checks one finding in the sandbox and merges the result into it.
 *
 * A sandbox problem only affects the finding being checked: it comes back
 * unconfirmed with a zero score, and the job carries on.
 */
@Component
public class FindingVerifier {

    private static final Logger log = LoggerFactory.getLogger(FindingVerifier.class);

    private final VerificationCodeGenerator generator;
    private final VerificationSandbox       sandbox;

    public FindingVerifier(VerificationCodeGenerator generator, VerificationSandbox sandbox) {
        this.generator = generator;
        this.sandbox   = sandbox;
    }

    /** @return the finding with its verification attached, or unchanged if it cannot be checked */
    public Finding verify(Finding finding, String target, ProcessTracker tracker) {
        Optional<GeneratedCode> code;
        try {
            code = generator.generate(finding, target);
        } catch (RuntimeException e) {
            log.warn("Could not generate verification code for finding {}: {}", finding.id(), e.getMessage());
            return finding.withVerification(VerificationResult.error(e.getMessage(), 0));
        }
        if (code.isEmpty()) {
            return finding;
        }

        VerificationJob job = VerificationJob.of(finding.id(), code.get().code(), code.get().language(),
                target, code.get().parameters(), 0);
        VerificationResult result;
        try {
            result = sandbox.execute(job, tracker);
        } catch (UnsupportedLanguageException | SandboxExecutionException e) {
            log.warn("Verification of finding {} could not run: {}", finding.id(), e.getMessage());
            result = VerificationResult.error(e.getMessage(), 0);
        } finally {
            sandbox.purge(job.id());
        }
        return finding.withVerification(result);
    }
}
