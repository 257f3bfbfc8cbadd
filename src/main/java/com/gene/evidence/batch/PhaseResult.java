package com.gene.evidence.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one pipeline phase.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseResult(
        @JsonProperty("status") Status status,
        @JsonProperty("duration_millis") long durationMillis,
        @JsonProperty("message") String message
) {
    public enum Status { OK, FAILED }

    public static PhaseResult ok(long durationMillis, String message) {
        return new PhaseResult(Status.OK, durationMillis, message);
    }

    public static PhaseResult failed(long durationMillis, String message) {
        return new PhaseResult(Status.FAILED, durationMillis, message);
    }

    public boolean succeeded() {
        return status == Status.OK;
    }
}
