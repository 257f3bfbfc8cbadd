package com.gene.evidence.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Per-gene source flags over the curated set: rows are symbols, columns are {@link #sources()}.
 */
public record CoverageMatrix(
        @JsonProperty("sources") List<String> sources,
        @JsonProperty("genes") Map<String, Map<String, Boolean>> genes,
        @JsonProperty("source_totals") Map<String, Integer> sourceTotals
) {
}
