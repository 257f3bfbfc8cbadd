package com.gene.evidence.snapshot;

import java.nio.file.Path;

/**
 * On-disk locations of every artifact, relative to the curated pipeline root and the
 * local workspace root.
 */
public record ArtifactLayout(Path curatedRoot, Path workspaceRoot) {

    public static final String GAP_CANDIDATES = "gap_candidates.json";
    public static final String GENOME_WIDE_SUMMARY = "genome_wide_summary.json";
    public static final String GENOME_WIDE_CSV = "genome_wide.csv";
    public static final String CANDIDATE_ENRICHMENT = "candidate_enrichment.json";
    public static final String PIPELINE_STATUS = "pipeline_status.json";

    public ArtifactLayout {
        curatedRoot = curatedRoot.normalize();
        workspaceRoot = workspaceRoot.normalize();
    }

    // curated pipeline outputs

    public Path curatedSources() {
        return curatedRoot.resolve("output").resolve("sources.json");
    }

    public Path gapReport() {
        return curatedRoot.resolve("output").resolve("gap_report.json");
    }

    // source files shipped with the curated pipeline

    public Path hpoPhenotypes() {
        return curatedRoot.resolve("data").resolve("hpo").resolve("genes_to_phenotype.txt");
    }

    public Path orphanetCache() {
        return curatedRoot.resolve("data").resolve("orphanet").resolve("orphanet_cache.json");
    }

    public Path omimSubset() {
        return curatedRoot.resolve("data").resolve("omim").resolve("omim_subset.json");
    }

    // workspace

    public Path expandedGenes() {
        return workspaceRoot.resolve("expanded").resolve("hgnc_craniofacial.json");
    }

    public Path derivedDirectory() {
        return workspaceRoot.resolve("derived");
    }

    public Path gapCandidates() {
        return derivedDirectory().resolve(GAP_CANDIDATES);
    }

    public Path genomeWideSummary() {
        return derivedDirectory().resolve(GENOME_WIDE_SUMMARY);
    }

    public Path genomeWideCsv() {
        return derivedDirectory().resolve(GENOME_WIDE_CSV);
    }

    public Path candidateEnrichment() {
        return derivedDirectory().resolve(CANDIDATE_ENRICHMENT);
    }

    public Path pipelineStatus() {
        return derivedDirectory().resolve(PIPELINE_STATUS);
    }
}
