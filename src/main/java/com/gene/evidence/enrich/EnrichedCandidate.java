package com.gene.evidence.enrich;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A gap candidate with quick external annotations to help decide whether it merits curation.
 * {@code failedLookups} names the services whose lookup failed; their fields hold empty values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnrichedCandidate(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("ncbi_id") String ncbiId,
        @JsonProperty("uniprot_id") String uniprotId,
        @JsonProperty("gene_summary") String geneSummary,
        @JsonProperty("pubmed_craniofacial_count") int pubmedCraniofacialCount,
        @JsonProperty("uniprot_function") String uniprotFunction,
        @JsonProperty("hpo_phenotype_count") int hpoPhenotypeCount,
        @JsonProperty("orphanet_disorder_count") int orphanetDisorderCount,
        @JsonProperty("hgnc_source") String hgncSource,
        @JsonProperty("failed_lookups") List<String> failedLookups
) {
    public EnrichedCandidate {
        failedLookups = failedLookups != null ? List.copyOf(failedLookups) : List.of();
    }
}
