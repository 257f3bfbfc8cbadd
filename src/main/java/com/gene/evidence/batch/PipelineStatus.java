package com.gene.evidence.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code derived/pipeline_status.json} artifact: per-phase outcome and artifact sizes.
 */
@JsonPropertyOrder({"run_id", "last_run", "duration_seconds", "phases", "files"})
public record PipelineStatus(
        @JsonProperty("run_id") String runId,
        @JsonProperty("last_run") Instant lastRun,
        @JsonProperty("duration_seconds") long durationSeconds,
        @JsonProperty("phases") Map<String, PhaseResult> phases,
        @JsonProperty("files") Map<String, Long> files
) {
    public PipelineStatus {
        phases = Collections.unmodifiableMap(new LinkedHashMap<>(phases));
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public boolean allSucceeded() {
        return phases.values().stream().allMatch(PhaseResult::succeeded);
    }
}
