package com.gene.evidence.batch;

import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.enrich.CandidateEnricher;
import com.gene.evidence.enrich.EnrichmentSnapshot;
import com.gene.evidence.metrics.PipelineMetrics;
import com.gene.evidence.snapshot.ArtifactLayout;
import com.gene.evidence.snapshot.ArtifactReader;
import com.gene.evidence.snapshot.AtomicArtifactWriter;
import com.gene.evidence.snapshot.LoadedArtifact;

/**
 * Enriches the top candidates of the last derivation and publishes
 * {@code derived/candidate_enrichment.json}.
 */
public class EnrichmentJob implements BatchJob {

    public static final String NAME = "enrichment";

    private final ArtifactLayout layout;
    private final ArtifactReader reader;
    private final CandidateEnricher enricher;
    private final int top;
    private final AtomicArtifactWriter writer;
    private final PipelineMetrics metrics;

    public EnrichmentJob(ArtifactLayout layout, ArtifactReader reader, CandidateEnricher enricher, int top,
                         AtomicArtifactWriter writer, PipelineMetrics metrics) {
        this.layout = layout;
        this.reader = reader;
        this.enricher = enricher;
        this.top = top;
        this.writer = writer;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String run(String runId) throws InterruptedException {
        LoadedArtifact<CandidateSnapshot> candidates =
                reader.read(layout.gapCandidates(), "derived", CandidateSnapshot.class, null);
        if (!candidates.status().isUsable()) {
            throw new IllegalStateException(ArtifactLayout.GAP_CANDIDATES + " not usable ("
                    + candidates.status() + "). Run the gap derivation job first.");
        }

        EnrichmentSnapshot snapshot = enricher.enrich(candidates.value(), top, runId);
        writer.writeJson(layout.candidateEnrichment(), snapshot);
        metrics.recordArtifactWritten(ArtifactLayout.CANDIDATE_ENRICHMENT);
        return snapshot.enrichedCount() + " enriched, " + snapshot.withPublications() + " with publications";
    }
}
