package com.gene.evidence.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of the expanded gene list, as produced by the HGNC selection step.
 *
 * <p>The {@code source} tag records why the gene is in the list:
 * {@code curated}, {@code group:<gene group>} or {@code name:<term>}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GeneRecord(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("name") String name,
        @JsonProperty("source") String source,
        @JsonProperty("hgnc_id") String hgncId,
        @JsonProperty("ncbi_id") String ncbiId,
        @JsonProperty("uniprot_id") String uniprotId,
        @JsonProperty("omim_id") String omimId,
        @JsonProperty("ensembl_id") String ensemblId,
        @JsonProperty("gene_group") List<String> geneGroups,
        @JsonProperty("location") String location
) {
    public static final String CURATED_SOURCE = "curated";

    public GeneRecord {
        symbol = GeneSymbol.normalize(symbol);
        name = name != null ? name : "";
        source = source != null ? source : "";
        hgncId = hgncId != null ? hgncId : "";
        ncbiId = ncbiId != null ? ncbiId : "";
        uniprotId = uniprotId != null ? uniprotId : "";
        omimId = omimId != null ? omimId : "";
        ensemblId = ensemblId != null ? ensemblId : "";
        geneGroups = geneGroups != null ? List.copyOf(geneGroups) : List.of();
        location = location != null ? location : "";
    }

    /**
     * Minimal record for a gene known only by symbol (a curated gene missing from the universe).
     */
    public static GeneRecord symbolOnly(String symbol, String source) {
        return new GeneRecord(symbol, "", source, "", "", "", "", "", List.of(), "");
    }

    @JsonIgnore
    public CrossReferences crossReferences() {
        return new CrossReferences(ncbiId, uniprotId, omimId, ensemblId);
    }
}
