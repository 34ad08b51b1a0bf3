package com.scanpilot.orchestrator.service;

import com.scanpilot.orchestrator.chain.GeneratedCode;
import com.scanpilot.orchestrator.chain.TemplateVerificationCodeGenerator;
import com.scanpilot.orchestrator.chain.VerificationCodeGenerator;
import com.scanpilot.orchestrator.model.Finding;
import com.scanpilot.orchestrator.model.Severity;
import com.scanpilot.orchestrator.process.ProcessTracker;
import com.scanpilot.orchestrator.sandbox.SandboxExecutionException;
import com.scanpilot.orchestrator.sandbox.VerificationJob;
import com.scanpilot.orchestrator.sandbox.VerificationResult;
import com.scanpilot.orchestrator.sandbox.VerificationSandbox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FindingVerifierTest {

    @Mock VerificationCodeGenerator generator;
    @Mock VerificationSandbox       sandbox;

    FindingVerifier verifier;

    Finding sqli = Finding.unverified("finding_1", "sql_injection", "SQL injection in parameter id",
            "sqlmap says so", Severity.HIGH, "id");

    @BeforeEach
    void setUp() {
        verifier = new FindingVerifier(generator, sandbox);
    }

    @Test
    void verify_confirmedRun_marksFindingVerified() {
        when(generator.generate(sqli, "http://t/?id=1")).thenReturn(Optional.of(
                new GeneratedCode("print('[+] hit')", "python", "check", Map.of("parameter", "id"))));
        when(sandbox.execute(any(), any())).thenReturn(new VerificationResult(true, true, "[+] hit", null, 40, 80));

        Finding result = verifier.verify(sqli, "http://t/?id=1", ProcessTracker.NONE);

        assertThat(result.verified()).isTrue();
        assertThat(result.verification().reliabilityScore()).isEqualTo(80);
        ArgumentCaptor<VerificationJob> job = ArgumentCaptor.forClass(VerificationJob.class);
        verify(sandbox).execute(job.capture(), any());
        assertThat(job.getValue().findingId()).isEqualTo("finding_1");
        assertThat(job.getValue().parameters()).containsEntry("parameter", "id");
        verify(sandbox).purge(job.getValue().id());
    }

    @Test
    void verify_noGeneratorForType_returnsFindingUnchanged() {
        when(generator.generate(any(), any())).thenReturn(Optional.empty());

        Finding result = verifier.verify(sqli, "t", ProcessTracker.NONE);

        assertThat(result).isSameAs(sqli);
        verifyNoInteractions(sandbox);
    }

    @Test
    void verify_sandboxCannotStart_recordsErrorResult() {
        when(generator.generate(any(), any())).thenReturn(Optional.of(
                new GeneratedCode("print(1)", "python", "check", Map.of())));
        when(sandbox.execute(any(), any()))
                .thenThrow(new SandboxExecutionException("python3 missing", new IOException("not found")));

        Finding result = verifier.verify(sqli, "t", ProcessTracker.NONE);

        assertThat(result.verified()).isFalse();
        assertThat(result.verification().reliabilityScore()).isZero();
        assertThat(result.verification().error()).contains("python3 missing");
        verify(sandbox).purge(any());
    }

    @Test
    void templates_coverSqlInjectionAndExposedPathOnly() {
        TemplateVerificationCodeGenerator templates = new TemplateVerificationCodeGenerator();

        assertThat(templates.generate(sqli, "http://t")).hasValueSatisfying(c -> {
            assertThat(c.language()).isEqualTo("python");
            assertThat(c.parameters()).containsEntry("parameter", "id");
        });
        assertThat(templates.generate(Finding.unverified("f", "exposed_path", "Reachable path /admin/", "",
                Severity.LOW, "/admin/"), "http://t")).isPresent();
        assertThat(templates.generate(Finding.unverified("f", "open_port", "Open port", "",
                Severity.INFO, "22/tcp"), "http://t")).isEmpty();
    }
}
