package com.gene.evidence.enrich;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gene.evidence.core.model.Provenance;

import java.util.List;

/**
 * The {@code derived/candidate_enrichment.json} artifact.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"_provenance", "enriched_count", "failed_lookup_count", "candidates"})
public record EnrichmentSnapshot(
        @JsonProperty("_provenance") Provenance provenance,
        @JsonProperty("enriched_count") int enrichedCount,
        @JsonProperty("failed_lookup_count") int failedLookupCount,
        @JsonProperty("candidates") List<EnrichedCandidate> candidates
) {
    public EnrichmentSnapshot {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public long withPublications() {
        return candidates.stream().filter(c -> c.pubmedCraniofacialCount() > 0).count();
    }
}
