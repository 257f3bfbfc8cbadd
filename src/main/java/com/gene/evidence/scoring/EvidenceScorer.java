package com.gene.evidence.scoring;

import com.gene.evidence.core.model.AggregatedGeneRecord;

/**
 * Maps joined evidence to one non-negative confidence score.
 * Implementations must be pure: the same evidence always yields the same score.
 */
public interface EvidenceScorer {

    double score(AggregatedGeneRecord record);

    ScoreBreakdown breakdown(AggregatedGeneRecord record);

    /**
     * Formula text recorded as a non-canonical element in artifact provenance.
     */
    String describe();
}
