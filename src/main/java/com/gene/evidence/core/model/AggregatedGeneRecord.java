package com.gene.evidence.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * All evidence known for one gene symbol after the join.
 * Every {@link EvidenceSource} has an entry; sources without data carry
 * {@link SourceEvidence#empty(EvidenceSource)}.
 */
public record AggregatedGeneRecord(
        String symbol,
        GeneRecord gene,
        Map<EvidenceSource, SourceEvidence> evidence,
        boolean curated
) {
    public AggregatedGeneRecord {
        Objects.requireNonNull(symbol, "symbol is required");
        Objects.requireNonNull(gene, "gene is required");
        EnumMap<EvidenceSource, SourceEvidence> complete = new EnumMap<>(EvidenceSource.class);
        for (EvidenceSource source : EvidenceSource.values()) {
            SourceEvidence value = evidence != null ? evidence.get(source) : null;
            complete.put(source, value != null ? value : SourceEvidence.empty(source));
        }
        evidence = Collections.unmodifiableMap(complete);
    }

    public SourceEvidence evidence(EvidenceSource source) {
        return evidence.get(source);
    }

    public CrossReferences crossReferences() {
        return gene.crossReferences();
    }

    /**
     * True for genes in the expanded list that are not part of the curated reference set.
     */
    public boolean expandedOnly() {
        return !curated;
    }

    /**
     * Number of sources (excluding curated pipeline coverage) with any evidence.
     */
    public int contributingSourceCount() {
        int count = 0;
        for (SourceEvidence value : evidence.values()) {
            if (value.source() != EvidenceSource.CURATED_PIPELINE && value.present()) {
                count++;
            }
        }
        return count;
    }
}
