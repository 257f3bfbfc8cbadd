package com.gene.evidence.genome;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gene.evidence.core.model.Provenance;

/**
 * Aggregate counts over the genome-wide table; the genome tier artifact.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"total_genes", "in_hpo", "in_orphanet", "in_omim", "in_curated",
        "with_phenotypes_and_no_curated", "disease_genes_not_curated", "_provenance"})
public record GenomeWideSummary(
        @JsonProperty("total_genes") int totalGenes,
        @JsonProperty("in_hpo") int inHpo,
        @JsonProperty("in_orphanet") int inOrphanet,
        @JsonProperty("in_omim") int inOmim,
        @JsonProperty("in_curated") int inCurated,
        @JsonProperty("with_phenotypes_and_no_curated") int withPhenotypesAndNoCurated,
        @JsonProperty("disease_genes_not_curated") int diseaseGenesNotCurated,
        @JsonProperty("_provenance") Provenance provenance
) {
}
