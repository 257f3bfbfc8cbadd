package com.gene.evidence.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record CoverageSummary(
        @JsonProperty("total_genes") int totalGenes,
        @JsonProperty("sources") Map<String, SourceCoverage> sources
) {
}
