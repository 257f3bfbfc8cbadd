package com.gene.evidence.core.model;

/**
 * Independent evidence sources joined per gene symbol.
 */
public enum EvidenceSource {
    HPO("HPO"),
    ORPHANET("Orphanet"),
    OMIM("OMIM"),
    CURATED_PIPELINE("Curated pipeline");

    private final String label;

    EvidenceSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
