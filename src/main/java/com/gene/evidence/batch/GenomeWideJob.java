package com.gene.evidence.batch;

import com.gene.evidence.genome.GenomeWideCsvExporter;
import com.gene.evidence.genome.GenomeWideRow;
import com.gene.evidence.genome.GenomeWideSummarizer;
import com.gene.evidence.genome.GenomeWideSummary;
import com.gene.evidence.metrics.PipelineMetrics;
import com.gene.evidence.snapshot.ArtifactLayout;
import com.gene.evidence.snapshot.AtomicArtifactWriter;

import java.util.List;

/**
 * Cross-references the gene universe with every source and publishes
 * {@code derived/genome_wide.csv} and {@code derived/genome_wide_summary.json}.
 */
public class GenomeWideJob implements BatchJob {

    public static final String NAME = "bulk_crossref";

    private final ArtifactLayout layout;
    private final EvidenceAssembler assembler;
    private final GenomeWideSummarizer summarizer;
    private final GenomeWideCsvExporter exporter;
    private final AtomicArtifactWriter writer;
    private final PipelineMetrics metrics;

    public GenomeWideJob(ArtifactLayout layout, EvidenceAssembler assembler, GenomeWideSummarizer summarizer,
                         GenomeWideCsvExporter exporter, AtomicArtifactWriter writer, PipelineMetrics metrics) {
        this.layout = layout;
        this.assembler = assembler;
        this.summarizer = summarizer;
        this.exporter = exporter;
        this.writer = writer;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String run(String runId) {
        List<GenomeWideRow> rows = summarizer.rows(assembler.assemble().records());
        GenomeWideSummary summary = summarizer.summarize(rows);

        writer.write(layout.genomeWideCsv(), out -> exporter.export(rows, out));
        metrics.recordArtifactWritten(ArtifactLayout.GENOME_WIDE_CSV);
        writer.writeJson(layout.genomeWideSummary(), summary);
        metrics.recordArtifactWritten(ArtifactLayout.GENOME_WIDE_SUMMARY);
        return summary.totalGenes() + " genes, " + summary.diseaseGenesNotCurated() + " disease genes not curated";
    }
}
