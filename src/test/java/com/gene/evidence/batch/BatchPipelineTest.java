package com.gene.evidence.batch;

import com.gene.evidence.TestSnapshots;
import com.gene.evidence.candidate.CandidateRecord;
import com.gene.evidence.candidate.CandidateSelector;
import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.enrich.CandidateEnricher;
import com.gene.evidence.enrich.EnrichmentSnapshot;
import com.gene.evidence.enrich.GeneAnnotationClient;
import com.gene.evidence.genome.GenomeWideCsvExporter;
import com.gene.evidence.genome.GenomeWideSummarizer;
import com.gene.evidence.genome.GenomeWideSummary;
import com.gene.evidence.metrics.NoOpPipelineMetrics;
import com.gene.evidence.metrics.PipelineMetrics;
import com.gene.evidence.scoring.LogarithmicEvidenceScorer;
import com.gene.evidence.snapshot.ArtifactLayout;
import com.gene.evidence.snapshot.ArtifactReader;
import com.gene.evidence.snapshot.AtomicArtifactWriter;
import com.gene.evidence.snapshot.JsonArtifacts;
import com.gene.evidence.source.ZincFingerExclusionRule;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Batch pipeline Tests")
class BatchPipelineTest {

    @TempDir
    Path tempDir;

    private ArtifactLayout layout;
    private AtomicArtifactWriter writer;
    private PipelineMetrics metrics;
    private Clock clock;

    @BeforeEach
    void setUp() {
        layout = new ArtifactLayout(tempDir.resolve("lacuene"), tempDir.resolve("workspace"));
        writer = new AtomicArtifactWriter();
        metrics = new NoOpPipelineMetrics();
        clock = Clock.fixed(TestSnapshots.LOADED_AT, ZoneOffset.UTC);
    }

    private void writeFile(Path path, String content) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    private void writeInputs() throws IOException {
        writeFile(layout.expandedGenes(), """
                [
                  {"symbol": "IRF6", "source": "curated", "ncbi_id": "3664"},
                  {"symbol": "GRHL3", "source": "group:Grainyhead like transcription factors", "ncbi_id": "57822"},
                  {"symbol": "ALX4", "source": "group:PRD class homeoboxes", "ncbi_id": "60529"},
                  {"symbol": "ACTB", "source": "name:actin"},
                  {"symbol": "ZNF141", "source": "group:Zinc fingers C2H2-type"}
                ]
                """);
        writeFile(layout.curatedSources(), """
                {"IRF6": {"in_go": true, "in_hpo": true}}
                """);
        writeFile(layout.hpoPhenotypes(), String.join("\n",
                "#ncbi_gene_id\tgene_symbol\thpo_id\thpo_name",
                "57822\tGRHL3\tHP:0000175\tCleft palate",
                "57822\tGRHL3\tHP:0000204\tCleft upper lip",
                "57822\tGRHL3\tHP:0000175\tCleft palate",
                "57822\tGRHL3\tHP:0001249\tIntellectual disability",
                "60529\tALX4\tHP:0002007\tFrontal bossing",
                "141\tZNF141\tHP:0001249\tIntellectual disability",
                "3664\tIRF6\tHP:0000175\tCleft palate"));
        writeFile(layout.omimSubset(), """
                {"genes": {"GRHL3": {"title": "Grainyhead-like 3", "syndromes": ["Van der Woude syndrome 2"]}}}
                """);
    }

    private EvidenceAssembler assembler() {
        return EvidenceAssembler.forLayout(layout, List.of(new ZincFingerExclusionRule()));
    }

    private GapDerivationJob derivationJob() {
        return new GapDerivationJob(layout, assembler(),
                new CandidateSelector(new LogarithmicEvidenceScorer(), clock), writer, metrics);
    }

    private EnrichmentJob enrichmentJob() {
        GeneAnnotationClient client = new GeneAnnotationClient() {
            @Override
            public String geneSummary(String ncbiId) {
                return "Summary of " + ncbiId;
            }

            @Override
            public int craniofacialPublicationCount(String symbol) {
                return 3;
            }

            @Override
            public String proteinFunction(String uniprotId) {
                return "";
            }
        };
        CandidateEnricher enricher = new CandidateEnricher(client, metrics, Duration.ZERO, d -> { }, clock);
        return new EnrichmentJob(layout, new ArtifactReader(), enricher, 20, writer, metrics);
    }

    private GenomeWideJob genomeWideJob() {
        return new GenomeWideJob(layout, assembler(), new GenomeWideSummarizer(clock),
                new GenomeWideCsvExporter(), writer, metrics);
    }

    @Nested
    @DisplayName("Gap derivation")
    class DerivationTests {

        @Test
        @DisplayName("Scores non-curated genes from local sources")
        void derivesCandidates() throws IOException {
            writeInputs();

            CandidateSnapshot snapshot = derivationJob().derive();

            assertEquals(1, snapshot.curatedCount());
            assertEquals(4, snapshot.expandedCount());
            assertEquals(List.of("GRHL3", "ALX4"),
                    snapshot.candidates().stream().map(CandidateRecord::symbol).toList());
            // log2(3+1) + 0 + (2 + log2(1+1))
            assertEquals(5.0, snapshot.candidates().get(0).confidenceScore());
            assertEquals(1.0, snapshot.candidates().get(1).confidenceScore());
            assertTrue(snapshot.provenance().nonCanonElements().contains("ZNF exclusion rule"));
        }

        @Test
        @DisplayName("Writes gap_candidates.json")
        void writesArtifact() throws Exception {
            writeInputs();

            String summary = derivationJob().run("run-1");

            assertEquals("2 candidates", summary);
            JsonNode written = JsonArtifacts.mapper().readTree(layout.gapCandidates().toFile());
            assertEquals(2, written.get("candidate_count").asInt());
            assertEquals("GRHL3", written.get("candidates").get(0).get("symbol").asText());
            assertTrue(written.has("_provenance"));
        }

        @Test
        @DisplayName("A missing gene universe fails the job")
        void missingUniverse() {
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> derivationJob().run("run-1"));
            assertTrue(e.getMessage().contains("Run the gene expansion step first"));
            assertFalse(Files.exists(layout.gapCandidates()));
        }
    }

    @Nested
    @DisplayName("Genome-wide cross-reference")
    class GenomeWideTests {

        @Test
        @DisplayName("Writes the CSV and the summary")
        void writesBoth() throws Exception {
            writeInputs();

            genomeWideJob().run("run-1");

            List<String> lines = Files.readAllLines(layout.genomeWideCsv());
            assertEquals(5, lines.size());
            assertTrue(lines.get(0).startsWith("symbol,name,"));

            GenomeWideSummary summary = new ArtifactReader()
                    .read(layout.genomeWideSummary(), "genome", GenomeWideSummary.class, null).value();
            assertEquals(4, summary.totalGenes());
            assertEquals(3, summary.inHpo());
            assertEquals(1, summary.inOmim());
            assertEquals(1, summary.inCurated());
            assertEquals(1, summary.diseaseGenesNotCurated());
        }
    }

    @Nested
    @DisplayName("Enrichment")
    class EnrichmentTests {

        @Test
        @DisplayName("Requires derived candidates")
        void requiresCandidates() {
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> enrichmentJob().run("run-1"));
            assertTrue(e.getMessage().contains(ArtifactLayout.GAP_CANDIDATES));
        }

        @Test
        @DisplayName("Enriches the derived candidates")
        void enriches() throws Exception {
            writeInputs();
            derivationJob().run("run-1");

            String summary = enrichmentJob().run("run-1");

            assertEquals("2 enriched, 2 with publications", summary);
            EnrichmentSnapshot snapshot = new ArtifactReader()
                    .read(layout.candidateEnrichment(), "derived", EnrichmentSnapshot.class, null).value();
            assertEquals("Summary of 57822", snapshot.candidates().get(0).geneSummary());
        }
    }

    @Nested
    @DisplayName("Pipeline")
    class PipelineTests {

        @Test
        @DisplayName("Runs every phase and records the outcome")
        void allPhases() throws IOException {
            writeInputs();
            BatchPipeline pipeline = new BatchPipeline(layout,
                    List.of(genomeWideJob(), derivationJob(), enrichmentJob()), writer, metrics, clock);

            PipelineStatus status = pipeline.run();

            assertTrue(status.allSucceeded());
            assertEquals(List.of(GenomeWideJob.NAME, GapDerivationJob.NAME, EnrichmentJob.NAME),
                    List.copyOf(status.phases().keySet()));
            assertEquals(TestSnapshots.LOADED_AT, status.lastRun());
            assertTrue(status.files().containsKey(ArtifactLayout.GAP_CANDIDATES));
            assertTrue(status.files().containsKey(ArtifactLayout.GENOME_WIDE_CSV));
            assertTrue(Files.exists(layout.pipelineStatus()));
        }

        @Test
        @DisplayName("A failing phase does not stop the next one")
        void isolatesFailures() throws IOException {
            BatchJob failing = new BatchJob() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public String run(String runId) {
                    throw new IllegalStateException("source file unreadable");
                }
            };
            BatchJob working = new BatchJob() {
                @Override
                public String getName() {
                    return "working";
                }

                @Override
                public String run(String runId) {
                    return "done";
                }
            };

            PipelineStatus status = new BatchPipeline(layout, List.of(failing, working), writer, metrics, clock).run();

            assertFalse(status.allSucceeded());
            assertEquals(PhaseResult.Status.FAILED, status.phases().get("broken").status());
            assertEquals("source file unreadable", status.phases().get("broken").message());
            assertTrue(status.phases().get("working").succeeded());
            assertEquals("done", status.phases().get("working").message());

            JsonNode written = JsonArtifacts.mapper().readTree(layout.pipelineStatus().toFile());
            assertEquals("FAILED", written.get("phases").get("broken").get("status").asText());
            assertTrue(status.files().isEmpty());
        }

        @Test
        @DisplayName("Without inputs every standard phase fails but status is still written")
        void noInputs() {
            PipelineStatus status = new BatchPipeline(layout,
                    List.of(genomeWideJob(), derivationJob(), enrichmentJob()), writer, metrics, clock).run();

            assertTrue(status.phases().values().stream().noneMatch(PhaseResult::succeeded));
            assertTrue(Files.exists(layout.pipelineStatus()));
        }
    }
}
