package com.scanpilot.orchestrator.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * What to run and under which limits.
 *
 * @param command            argument vector; element 0 is the executable, nothing is shell-parsed
 * @param workingDirectory   child cwd, or null to inherit ours
 * @param environment        variables to set on the child
 * @param inheritEnvironment false clears our environment before {@code environment} is applied
 * @param timeout            hard wall-clock limit; the child is killed when it elapses
 * @param maxOutputBytes     per-stream capture cap; excess output is drained and discarded
 */
public record ProcessSpec(
        List<String>        command,
        Path                workingDirectory,
        Map<String, String> environment,
        boolean             inheritEnvironment,
        Duration            timeout,
        int                 maxOutputBytes) {

    public ProcessSpec {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        command     = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
