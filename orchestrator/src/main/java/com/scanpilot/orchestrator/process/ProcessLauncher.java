package com.scanpilot.orchestrator.process;

import java.io.IOException;

/**
 * Starts a configured {@link ProcessBuilder}. The production launcher is
 * simply {@code ProcessBuilder::start}; tests substitute a counting one.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(ProcessBuilder builder) throws IOException;
}
