package com.scanpilot.orchestrator.model;

/**
 * The fixed stages of the assessment pipeline, in execution order.
 *
 * {@code checkpoint} is the progress value persisted when the stage finishes.
 * Dashboards poll on these numbers, so they must not change.
 * {@code nextLabel} is the stage label shown once the stage is done.
 */
public enum PipelineStage {
    INIT             (10,  "target analysis"),
    CHAIN_EXECUTION  (60,  "finding verification"),
    VERIFICATION     (80,  "report assembly"),
    REPORT_ASSEMBLY  (100, "completed");

    /** Label stored on a freshly accepted job. */
    public static final String ACCEPTED_LABEL = "queued";

    /** Label stored when a worker starts the job. */
    public static final String STARTING_LABEL = "initializing AI service";

    private final int    checkpoint;
    private final String nextLabel;

    PipelineStage(int checkpoint, String nextLabel) {
        this.checkpoint = checkpoint;
        this.nextLabel  = nextLabel;
    }

    public int    checkpoint() { return checkpoint; }
    public String nextLabel()  { return nextLabel; }
}
