package com.gene.evidence.candidate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gene.evidence.core.model.AggregatedGeneRecord;
import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.SourceEvidence;

import java.util.List;

/**
 * Evidence summary stored with each candidate. Detail lists are truncated for display;
 * the counts are always the full counts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceBreakdown(
        @JsonProperty("hpo_phenotype_count") int hpoPhenotypeCount,
        @JsonProperty("hpo_top_terms") List<String> hpoTopTerms,
        @JsonProperty("orphanet_disorder_count") int orphanetDisorderCount,
        @JsonProperty("orphanet_disorders") List<String> orphanetDisorders,
        @JsonProperty("has_omim") boolean hasOmim,
        @JsonProperty("omim_title") String omimTitle,
        @JsonProperty("omim_syndrome_count") int omimSyndromeCount
) {
    static final int TOP_PHENOTYPES = 10;
    static final int TOP_DISORDERS = 5;

    public EvidenceBreakdown {
        hpoTopTerms = hpoTopTerms != null ? List.copyOf(hpoTopTerms) : List.of();
        orphanetDisorders = orphanetDisorders != null ? List.copyOf(orphanetDisorders) : List.of();
        omimTitle = omimTitle != null ? omimTitle : "";
    }

    public static EvidenceBreakdown of(AggregatedGeneRecord record) {
        SourceEvidence hpo = record.evidence(EvidenceSource.HPO);
        SourceEvidence orphanet = record.evidence(EvidenceSource.ORPHANET);
        SourceEvidence omim = record.evidence(EvidenceSource.OMIM);
        return new EvidenceBreakdown(
                hpo.count(),
                hpo.topDetails(TOP_PHENOTYPES),
                orphanet.count(),
                orphanet.topDetails(TOP_DISORDERS),
                omim.present(),
                omim.present() ? omim.label() : "",
                omim.present() ? omim.count() : 0);
    }
}
