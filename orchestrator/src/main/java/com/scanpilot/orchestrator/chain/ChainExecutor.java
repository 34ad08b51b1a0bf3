package com.scanpilot.orchestrator.chain;

/**
 * The analysis chain: runs tools against the target and turns their output
 * into findings. May run for a long time and should honour
 * {@link ChainListener#stopRequested()}.
 */
public interface ChainExecutor {

    ChainResult execute(ChainRequest request);
}
