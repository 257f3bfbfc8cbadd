package com.gene.evidence.batch;

import com.gene.evidence.candidate.CandidateSelector;
import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.metrics.PipelineMetrics;
import com.gene.evidence.snapshot.ArtifactLayout;
import com.gene.evidence.snapshot.AtomicArtifactWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates, scores and selects gap candidates, then publishes {@code derived/gap_candidates.json}.
 */
public class GapDerivationJob implements BatchJob {
    private static final Logger log = LoggerFactory.getLogger(GapDerivationJob.class);

    public static final String NAME = "gap_candidates";

    private final ArtifactLayout layout;
    private final EvidenceAssembler assembler;
    private final CandidateSelector selector;
    private final AtomicArtifactWriter writer;
    private final PipelineMetrics metrics;

    public GapDerivationJob(ArtifactLayout layout, EvidenceAssembler assembler, CandidateSelector selector,
                            AtomicArtifactWriter writer, PipelineMetrics metrics) {
        this.layout = layout;
        this.assembler = assembler;
        this.selector = selector;
        this.writer = writer;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String run(String runId) {
        CandidateSnapshot snapshot = derive();
        writer.writeJson(layout.gapCandidates(), snapshot);
        metrics.recordArtifactWritten(ArtifactLayout.GAP_CANDIDATES);
        metrics.recordCandidateCount(snapshot.candidateCount());
        log.info("derivation.completed candidates={} distribution={}",
                snapshot.candidateCount(), snapshot.scoreDistribution());
        return snapshot.candidateCount() + " candidates";
    }

    /**
     * Computes the candidate artifact without writing it.
     */
    public CandidateSnapshot derive() {
        AssembledEvidence evidence = assembler.assemble();
        CandidateSnapshot selected = selector.select(evidence.records(), evidence.exclusionRules());
        return new CandidateSnapshot(selected.provenance(), evidence.curatedCount(), evidence.universeSize(),
                selected.candidateCount(), selected.scoreDistribution(), selected.candidates());
    }
}
