package com.gene.evidence.api;

import com.gene.evidence.candidate.CandidateRecord;
import com.gene.evidence.core.model.Provenance;

import java.util.List;
import java.util.Map;

/**
 * Candidates after applying the score floor and limit.
 *
 * @param candidateCount total candidates in the artifact
 * @param matchingCount  candidates at or above {@code minScore}, before the limit
 */
public record CandidatePage(
        Provenance provenance,
        int candidateCount,
        int matchingCount,
        Map<String, Integer> scoreDistribution,
        double minScore,
        int limit,
        List<CandidateRecord> candidates
) {
}
