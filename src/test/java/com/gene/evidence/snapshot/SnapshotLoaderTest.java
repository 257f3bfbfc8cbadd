package com.gene.evidence.snapshot;

import com.gene.evidence.candidate.CandidateRecord;
import com.gene.evidence.candidate.CandidateSelector;
import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.core.model.Tier;
import com.gene.evidence.scoring.LogarithmicEvidenceScorer;
import com.gene.evidence.source.GeneUniverseLoader;
import com.gene.evidence.source.ZincFingerExclusionRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.gene.evidence.TestRecords.candidate;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SnapshotLoader Tests")
class SnapshotLoaderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T06:00:00Z");

    @TempDir
    Path tempDir;

    private ArtifactLayout layout;
    private SnapshotLoader loader;

    @BeforeEach
    void setUp() {
        layout = new ArtifactLayout(tempDir.resolve("lacuene"), tempDir.resolve("workspace"));
        loader = new SnapshotLoader(layout, new ArtifactReader(),
                new GeneUniverseLoader(List.of(new ZincFingerExclusionRule())),
                new ProvenanceScanner(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void write(Path path, String content) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    @Nested
    @DisplayName("Fail-soft loading")
    class FailSoftTests {

        @Test
        @DisplayName("No artifacts at all yields an empty snapshot with MISSING statuses")
        void nothingOnDisk() {
            ServedSnapshot snapshot = loader.load();

            for (Tier tier : Tier.values()) {
                assertFalse(snapshot.isAvailable(tier));
                assertEquals(ArtifactStatus.MISSING, snapshot.getStatus(tier));
            }
            assertEquals(NOW, snapshot.getLoadedAt());
            assertTrue(snapshot.getCandidates().isEmpty());
        }

        @Test
        @DisplayName("A malformed artifact empties only its own tier")
        void malformedIsolated() throws IOException {
            write(layout.curatedSources(), "{\"IRF6\": {\"in_go\": true}}");
            write(layout.expandedGenes(), "[{\"symbol\": ");

            ServedSnapshot snapshot = loader.load();

            assertTrue(snapshot.isAvailable(Tier.CURATED));
            assertEquals(ArtifactStatus.LOADED, snapshot.getStatus(Tier.CURATED));
            assertFalse(snapshot.isAvailable(Tier.EXPANDED));
            assertEquals(ArtifactStatus.MALFORMED, snapshot.getStatus(Tier.EXPANDED));
        }
    }

    @Nested
    @DisplayName("Tier contents")
    class ContentTests {

        @Test
        @DisplayName("Loads curated, expanded, genome and gap report")
        void loadsEveryTier() throws IOException {
            write(layout.curatedSources(), "{\"irf6\": {\"in_go\": true}, \"MSX1\": {\"in_go\": false}}");
            write(layout.gapReport(), "{\"total_genes\": 2}");
            write(layout.expandedGenes(), """
                    [{"symbol": "IRF6", "source": "curated"},
                     {"symbol": "ZNF141", "source": "group:Zinc fingers C2H2-type"},
                     {"symbol": "GRHL3", "source": "group:Grainyhead"}]
                    """);
            write(layout.genomeWideSummary(), "{\"total_genes\": 19000, \"in_hpo\": 5000}");

            ServedSnapshot snapshot = loader.load();

            assertEquals(List.of("IRF6", "MSX1"), snapshot.getCuratedSymbols());
            assertEquals(2, snapshot.size(Tier.EXPANDED));
            assertTrue(snapshot.findExpanded("grhl3").isPresent());
            assertTrue(snapshot.findExpanded("ZNF141").isEmpty());
            assertEquals(19000, snapshot.getGenomeSummary().get("total_genes"));
            assertEquals(ArtifactStatus.LOADED, snapshot.getGapReportStatus());
        }

        @Test
        @DisplayName("Candidate artifact round-trips count, distribution and order")
        void candidatesRoundTrip() {
            CandidateSnapshot written = new CandidateSelector(new LogarithmicEvidenceScorer(),
                    Clock.fixed(NOW, ZoneOffset.UTC)).select(List.of(
                    candidate("ALX4", 3, 0, false, 0),
                    candidate("TCOF1", 360, 18, true, 5),
                    candidate("MSX2", 3, 0, false, 0)), List.of());
            new AtomicArtifactWriter().writeJson(layout.gapCandidates(), written);

            ServedSnapshot snapshot = loader.load();
            CandidateSnapshot read = snapshot.getCandidates().orElseThrow();

            assertEquals(ArtifactStatus.LOADED, snapshot.getStatus(Tier.DERIVED));
            assertEquals(3, read.candidateCount());
            assertEquals(written.scoreDistribution(), read.scoreDistribution());
            assertEquals(List.of("TCOF1", "ALX4", "MSX2"),
                    read.candidates().stream().map(CandidateRecord::symbol).toList());
            assertEquals(25.8, read.candidates().get(0).confidenceScore());
            assertEquals(NOW, read.provenance().generated());
            assertEquals(1, snapshot.getProvenanceAudit().size());
            assertEquals(ArtifactLayout.GAP_CANDIDATES, snapshot.getProvenanceAudit().get(0).artifact());
        }
    }

    @Nested
    @DisplayName("ServedSnapshotHolder")
    class HolderTests {

        @Test
        @DisplayName("Reload swaps in a complete new snapshot")
        void reloadSwaps() throws IOException {
            ServedSnapshotHolder holder = new ServedSnapshotHolder(loader.load());
            ServedSnapshot before = holder.current();
            assertFalse(before.isAvailable(Tier.CURATED));

            write(layout.curatedSources(), "{\"IRF6\": {\"in_go\": true}}");
            holder.reload(loader::load);

            assertTrue(holder.current().isAvailable(Tier.CURATED));
            assertFalse(before.isAvailable(Tier.CURATED), "previous snapshot must not change");
        }

        @Test
        @DisplayName("A failing reload keeps the current snapshot")
        void failedReloadKeepsCurrent() {
            ServedSnapshot initial = ServedSnapshot.empty();
            ServedSnapshotHolder holder = new ServedSnapshotHolder(initial);

            assertThrows(IllegalStateException.class, () -> holder.reload(() -> {
                throw new IllegalStateException("boom");
            }));
            assertSame(initial, holder.current());
        }
    }

    @Nested
    @DisplayName("ProvenanceScanner")
    class ScannerTests {

        @Test
        @DisplayName("Lists provenance blocks of derived artifacts in file name order")
        void scansBlocks() throws IOException {
            Path derived = layout.derivedDirectory();
            write(derived.resolve("b.json"), "{\"_provenance\": {\"worker\": \"b\"}}");
            write(derived.resolve("a.json"), "{\"_provenance\": {\"worker\": \"a\"}}");
            write(derived.resolve("c.json"), "{\"no_provenance\": true}");
            write(derived.resolve("broken.json"), "{");
            write(derived.resolve("notes.txt"), "{\"_provenance\": {}}");

            List<ProvenanceAuditEntry> entries = new ProvenanceScanner().scan(derived);

            assertEquals(List.of("a.json", "b.json"), entries.stream().map(ProvenanceAuditEntry::artifact).toList());
            assertEquals("a", entries.get(0).provenance().get("worker"));
        }

        @Test
        @DisplayName("Missing directory yields no entries")
        void missingDirectory() {
            assertTrue(new ProvenanceScanner().scan(tempDir.resolve("absent")).isEmpty());
        }
    }
}
