package com.gene.evidence.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gene.evidence.api.CandidatePage;
import com.gene.evidence.candidate.CandidateRecord;
import com.gene.evidence.core.model.Provenance;

import java.util.List;
import java.util.Map;

public record CandidateListResponse(
        @JsonProperty("_provenance") Provenance provenance,
        @JsonProperty("candidate_count") int candidateCount,
        @JsonProperty("matching_count") int matchingCount,
        @JsonProperty("returned") int returned,
        @JsonProperty("min_score") double minScore,
        @JsonProperty("limit") int limit,
        @JsonProperty("score_distribution") Map<String, Integer> scoreDistribution,
        @JsonProperty("candidates") List<CandidateRecord> candidates
) {
    public static CandidateListResponse from(CandidatePage page) {
        return new CandidateListResponse(
                page.provenance(),
                page.candidateCount(),
                page.matchingCount(),
                page.candidates().size(),
                page.minScore(),
                page.limit(),
                page.scoreDistribution(),
                page.candidates());
    }
}
