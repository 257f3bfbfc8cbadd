package com.gene.evidence.candidate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gene.evidence.core.model.Provenance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The derived-tier artifact ({@code derived/gap_candidates.json}).
 * Written whole by each derivation run and never patched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"_provenance", "curated_count", "expanded_count", "candidate_count",
        "score_distribution", "candidates"})
public record CandidateSnapshot(
        @JsonProperty("_provenance") Provenance provenance,
        @JsonProperty("curated_count") int curatedCount,
        @JsonProperty("expanded_count") int expandedCount,
        @JsonProperty("candidate_count") int candidateCount,
        @JsonProperty("score_distribution") Map<String, Integer> scoreDistribution,
        @JsonProperty("candidates") List<CandidateRecord> candidates
) {
    public CandidateSnapshot {
        scoreDistribution = scoreDistribution != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(scoreDistribution))
                : Map.of();
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }
}
