package com.gene.evidence.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * External database identifiers for a gene.
 */
public record CrossReferences(
        @JsonProperty("ncbi_id") String ncbiId,
        @JsonProperty("uniprot_id") String uniprotId,
        @JsonProperty("omim_id") String omimId,
        @JsonProperty("ensembl_id") String ensemblId
) {
    public CrossReferences {
        ncbiId = ncbiId != null ? ncbiId : "";
        uniprotId = uniprotId != null ? uniprotId : "";
        omimId = omimId != null ? omimId : "";
        ensemblId = ensemblId != null ? ensemblId : "";
    }

    public static CrossReferences empty() {
        return new CrossReferences("", "", "", "");
    }
}
