package com.gene.evidence.batch;

import com.gene.evidence.core.model.AggregatedGeneRecord;

import java.util.List;

/**
 * Aggregated records of one batch run plus what went into them.
 *
 * @param universeSize   genes in the expanded list after exclusion rules
 * @param exclusionRules descriptions of the applied exclusion rules
 */
public record AssembledEvidence(
        List<AggregatedGeneRecord> records,
        int universeSize,
        int curatedCount,
        List<String> exclusionRules
) {
    public AssembledEvidence {
        records = List.copyOf(records);
        exclusionRules = List.copyOf(exclusionRules);
    }
}
