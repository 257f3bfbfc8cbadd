package com.gene.evidence.api;

import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.core.model.Tier;

import java.util.Map;

/**
 * One gene as known to the served tiers.
 *
 * @param symbol  normalized symbol
 * @param tier    {@link Tier#CURATED} for a curated match, {@link Tier#EXPANDED} for a known-but-uncurated gene
 * @param sources curated source flags, null for an expanded-only gene
 * @param hgnc    expanded gene record, null when the gene is not in the expanded list
 * @param note    explanation attached to reduced records
 */
public record GeneDetail(
        String symbol,
        Tier tier,
        Map<String, Object> sources,
        GeneRecord hgnc,
        String note
) {
    public static final String UNCURATED_NOTE =
            "Gene is in expanded set but not yet curated. No source data available.";

    public boolean isCurated() {
        return tier == Tier.CURATED;
    }
}
