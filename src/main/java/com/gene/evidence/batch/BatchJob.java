package com.gene.evidence.batch;

/**
 * One phase of the offline pipeline. Each run recomputes its artifacts from scratch.
 */
public interface BatchJob {

    /**
     * Phase name used in logs, metrics and {@code pipeline_status.json}.
     */
    String getName();

    /**
     * Runs the phase and returns a one-line summary.
     *
     * @throws Exception any failure; the pipeline records it and moves on to the next phase
     */
    String run(String runId) throws Exception;
}
