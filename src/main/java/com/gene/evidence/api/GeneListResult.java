package com.gene.evidence.api;

import com.gene.evidence.tier.TierResolution;

import java.util.List;
import java.util.Map;

/**
 * Genes of a resolved tier. For the genome tier {@code genes} is empty and {@code summary}
 * carries the aggregate counts instead.
 */
public record GeneListResult(
        TierResolution resolution,
        int count,
        List<String> genes,
        Map<String, Object> summary
) {
    public GeneListResult {
        genes = genes != null ? List.copyOf(genes) : List.of();
        summary = summary != null ? summary : Map.of();
    }
}
