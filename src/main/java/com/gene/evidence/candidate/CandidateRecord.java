package com.gene.evidence.candidate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gene.evidence.core.model.CrossReferences;
import com.gene.evidence.core.model.GeneSymbol;

import java.util.List;

/**
 * A gene outside the curated set with a positive confidence score.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CandidateRecord(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("name") String name,
        @JsonProperty("hgnc_source") String hgncSource,
        @JsonProperty("gene_group") List<String> geneGroups,
        @JsonProperty("location") String location,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("evidence") EvidenceBreakdown evidence,
        @JsonProperty("cross_references") CrossReferences crossReferences
) {
    public CandidateRecord {
        symbol = GeneSymbol.normalize(symbol);
        name = name != null ? name : "";
        hgncSource = hgncSource != null ? hgncSource : "";
        geneGroups = geneGroups != null ? List.copyOf(geneGroups) : List.of();
        location = location != null ? location : "";
        crossReferences = crossReferences != null ? crossReferences : CrossReferences.empty();
    }

    /**
     * Phenotype term count, or zero when no breakdown is attached.
     */
    public int phenotypeCount() {
        return evidence != null ? evidence.hpoPhenotypeCount() : 0;
    }
}
