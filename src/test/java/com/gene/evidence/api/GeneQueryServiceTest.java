package com.gene.evidence.api;

import com.gene.evidence.TestSnapshots;
import com.gene.evidence.candidate.CandidateRecord;
import com.gene.evidence.core.model.Tier;
import com.gene.evidence.health.HealthCheckRegistry;
import com.gene.evidence.health.HealthStatus;
import com.gene.evidence.health.SnapshotHealthCheck;
import com.gene.evidence.metrics.PipelineMetrics;
import com.gene.evidence.snapshot.ArtifactStatus;
import com.gene.evidence.snapshot.ServedSnapshot;
import com.gene.evidence.snapshot.ServedSnapshotHolder;
import com.gene.evidence.tier.TierResolver;
import com.gene.evidence.tier.TierUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("GeneQueryService Tests")
class GeneQueryServiceTest {

    @Mock
    PipelineMetrics metrics;

    private ServedSnapshotHolder holder;
    private GeneQueryService service;

    @BeforeEach
    void setUp() {
        holder = new ServedSnapshotHolder(TestSnapshots.full());
        HealthCheckRegistry health = new HealthCheckRegistry().register(new SnapshotHealthCheck(holder));
        service = new GeneQueryService(holder, new TierResolver(), health, metrics, 2, 3,
                Clock.fixed(TestSnapshots.LOADED_AT, ZoneOffset.UTC));
    }

    private static List<String> symbols(CandidatePage page) {
        return page.candidates().stream().map(CandidateRecord::symbol).toList();
    }

    @Nested
    @DisplayName("listGenes")
    class ListGenesTests {

        @Test
        @DisplayName("Defaults to the curated tier")
        void defaultsToCurated() {
            GeneListResult result = service.listGenes(null);

            assertEquals(Tier.CURATED, result.resolution().served());
            assertEquals(4, result.count());
            assertEquals(List.of("IRF6", "MSX1", "SOX9", "TCOF1"), result.genes());
            verify(metrics).incrementTierQuery(Tier.CURATED, Tier.CURATED);
        }

        @Test
        @DisplayName("Serves the expanded tier when present")
        void servesExpanded() {
            GeneListResult result = service.listGenes("expanded");

            assertFalse(result.resolution().isFallback());
            assertEquals(List.of("IRF6", "GRHL3", "ZEB2"), result.genes());
        }

        @Test
        @DisplayName("Empty expanded falls back to curated")
        void expandedFallback() {
            holder.swap(TestSnapshots.curatedOnly());

            GeneListResult result = service.listGenes("expanded");

            assertTrue(result.resolution().isFallback());
            assertEquals(Tier.CURATED, result.resolution().served());
            assertEquals("Expanded data not available, serving curated", result.resolution().reason());
            assertEquals(4, result.count());
            verify(metrics).incrementTierQuery(Tier.EXPANDED, Tier.CURATED);
        }

        @Test
        @DisplayName("Genome tier returns the summary, not a gene list")
        void genomeSummary() {
            GeneListResult result = service.listGenes("genome");

            assertEquals(Tier.GENOME, result.resolution().served());
            assertTrue(result.genes().isEmpty());
            assertEquals(19000, result.summary().get("total_genes"));
        }

        @Test
        @DisplayName("Unknown tier is rejected with the valid names")
        void unknownTier() {
            InvalidQueryException e = assertThrows(InvalidQueryException.class, () -> service.listGenes("everything"));
            assertEquals(List.of("curated", "expanded", "genome"), e.getValidValues());
        }

        @Test
        @DisplayName("Derived is not a listable tier")
        void derivedRejected() {
            assertThrows(InvalidQueryException.class, () -> service.listGenes("derived"));
        }

        @Test
        @DisplayName("Loaded genome summary with no fields is still served")
        void emptyGenomeSummaryServed() {
            holder.swap(TestSnapshots.fullBuilder().genomeSummary(Map.of(), ArtifactStatus.LOADED).build());

            GeneListResult result = service.listGenes("genome");

            assertEquals(Tier.GENOME, result.resolution().served());
            assertFalse(result.resolution().isFallback());
            assertTrue(result.summary().isEmpty());
        }

        @Test
        @DisplayName("Missing genome tier is unavailable and counted")
        void genomeUnavailable() {
            holder.swap(TestSnapshots.curatedOnly());

            assertThrows(TierUnavailableException.class, () -> service.listGenes("genome"));
            verify(metrics).incrementTierUnavailable(Tier.GENOME);
        }
    }

    @Nested
    @DisplayName("geneDetail")
    class GeneDetailTests {

        @Test
        @DisplayName("Curated gene returns its source flags and HGNC record")
        void curatedGene() {
            GeneDetail detail = service.geneDetail("irf6");

            assertEquals("IRF6", detail.symbol());
            assertTrue(detail.isCurated());
            assertEquals(true, detail.sources().get("in_go"));
            assertNotNull(detail.hgnc());
            assertNull(detail.note());
        }

        @Test
        @DisplayName("Expanded-only gene is marked uncurated")
        void expandedOnlyGene() {
            GeneDetail detail = service.geneDetail("GRHL3");

            assertEquals(Tier.EXPANDED, detail.tier());
            assertNull(detail.sources());
            assertEquals(GeneDetail.UNCURATED_NOTE, detail.note());
        }

        @Test
        @DisplayName("Unknown gene is not found")
        void unknownGene() {
            GeneNotFoundException e = assertThrows(GeneNotFoundException.class, () -> service.geneDetail("NOPE1"));
            assertEquals("Gene NOPE1 not found in any tier", e.getMessage());
        }

        @Test
        @DisplayName("Lookup needs curated data even for expanded genes")
        void requiresCurated() {
            holder.swap(ServedSnapshot.builder()
                    .expandedGenes(TestSnapshots.expandedGenes(), ArtifactStatus.LOADED)
                    .build());

            assertThrows(TierUnavailableException.class, () -> service.geneDetail("GRHL3"));
        }
    }

    @Nested
    @DisplayName("Coverage")
    class CoverageTests {

        @Test
        @DisplayName("Counts truthy flags per source over the curated population")
        void coverageSummary() {
            CoverageSummary coverage = service.coverage();

            assertEquals(4, coverage.totalGenes());
            assertEquals(GeneQueryService.COVERAGE_SOURCES, List.copyOf(coverage.sources().keySet()));
            assertEquals(new SourceCoverage(3, 4, 75.0), coverage.sources().get("go"));
            assertEquals(new SourceCoverage(2, 4, 50.0), coverage.sources().get("hpo"));
            assertEquals(new SourceCoverage(1, 4, 25.0), coverage.sources().get("omim"));
            assertEquals(0, coverage.sources().get("gtex").count());
        }

        @Test
        @DisplayName("Percentages are rounded to one decimal")
        void percentRounding() {
            assertEquals(33.3, SourceCoverage.of(1, 3).percent());
            assertEquals(0.0, SourceCoverage.of(0, 0).percent());
        }

        @Test
        @DisplayName("Matrix has one row per curated gene and per-source totals")
        void coverageMatrix() {
            CoverageMatrix matrix = service.coverageMatrix();

            assertEquals(4, matrix.genes().size());
            assertTrue(matrix.genes().get("IRF6").get("omim"));
            assertFalse(matrix.genes().get("MSX1").get("hpo"));
            assertEquals(3, matrix.sourceTotals().get("go"));
        }

        @Test
        @DisplayName("isTruthy follows JSON truthiness")
        void truthiness() {
            assertTrue(GeneQueryService.isTruthy(true));
            assertTrue(GeneQueryService.isTruthy(2));
            assertTrue(GeneQueryService.isTruthy("yes"));
            assertTrue(GeneQueryService.isTruthy(List.of(1)));
            assertFalse(GeneQueryService.isTruthy(false));
            assertFalse(GeneQueryService.isTruthy(0));
            assertFalse(GeneQueryService.isTruthy(""));
            assertFalse(GeneQueryService.isTruthy(Map.of()));
            assertFalse(GeneQueryService.isTruthy(null));
        }
    }

    @Nested
    @DisplayName("candidates")
    class CandidateTests {

        @Test
        @DisplayName("Defaults: min_score 0 and the configured default limit")
        void defaults() {
            CandidatePage page = service.candidates(null, null);

            assertEquals(0.0, page.minScore());
            assertEquals(2, page.limit());
            assertEquals(5, page.candidateCount());
            assertEquals(5, page.matchingCount());
            assertEquals(List.of("GRHL3", "ZEB2"), symbols(page));
        }

        @Test
        @DisplayName("Filters by minimum score and keeps stored order")
        void minScoreFilter() {
            CandidatePage page = service.candidates("2", "3");

            assertEquals(4, page.matchingCount());
            assertEquals(List.of("GRHL3", "ZEB2", "ALX4"), symbols(page));
            assertTrue(page.candidates().stream().allMatch(c -> c.confidenceScore() >= 2.0));
        }

        @Test
        @DisplayName("Limit above the maximum is capped")
        void limitCapped() {
            CandidatePage page = service.candidates("", "1000");
            assertEquals(3, page.limit());
            assertEquals(3, page.candidates().size());
        }

        @Test
        @DisplayName("Distribution is served as stored")
        void distributionPassedThrough() {
            Map<String, Integer> distribution = service.candidates(null, null).scoreDistribution();
            assertEquals(1, distribution.get("high (12+)"));
            assertEquals(1, distribution.get("medium (6-11.9)"));
            assertEquals(3, distribution.get("low (<6)"));
        }

        @Test
        @DisplayName("Malformed filters are rejected before data is touched")
        void malformedFilters() {
            holder.swap(ServedSnapshot.empty());

            assertThrows(InvalidQueryException.class, () -> service.candidates("abc", null));
            assertThrows(InvalidQueryException.class, () -> service.candidates("-1", null));
            assertThrows(InvalidQueryException.class, () -> service.candidates("3.5", null));
            assertThrows(InvalidQueryException.class, () -> service.candidates("1e1", null));
            assertThrows(InvalidQueryException.class, () -> service.candidates(null, "0"));
            assertThrows(InvalidQueryException.class, () -> service.candidates(null, "ten"));
        }

        @Test
        @DisplayName("Whole integer min_score with surrounding spaces is accepted")
        void integerMinScore() {
            CandidatePage page = service.candidates(" 12 ", "3");

            assertEquals(12.0, page.minScore());
            assertEquals(List.of("GRHL3"), symbols(page));
        }

        @Test
        @DisplayName("Loaded artifact with zero candidates is served, not unavailable")
        void zeroCandidatesServed() {
            holder.swap(TestSnapshots.fullBuilder()
                    .candidates(TestSnapshots.emptyCandidates(), ArtifactStatus.LOADED)
                    .build());

            CandidatePage page = service.candidates(null, null);

            assertEquals(0, page.candidateCount());
            assertEquals(0, page.matchingCount());
            assertTrue(page.candidates().isEmpty());
            assertEquals(List.of("high (12+)", "medium (6-11.9)", "low (<6)"),
                    List.copyOf(page.scoreDistribution().keySet()));
            assertTrue(page.scoreDistribution().values().stream().allMatch(count -> count == 0));
        }

        @Test
        @DisplayName("Zero candidates still report the derived tier as available")
        void zeroCandidatesStatus() {
            holder.swap(TestSnapshots.fullBuilder()
                    .candidates(TestSnapshots.emptyCandidates(), ArtifactStatus.LOADED)
                    .build());

            ServiceStatus status = service.status();

            assertTrue(status.tiers().get("derived").available());
            assertEquals(0, status.tiers().get("derived").entries());
        }

        @Test
        @DisplayName("Missing candidate artifact is unavailable")
        void unavailable() {
            holder.swap(TestSnapshots.curatedOnly());

            TierUnavailableException e = assertThrows(TierUnavailableException.class,
                    () -> service.candidates(null, null));
            assertEquals(Tier.DERIVED, e.getTier());
        }
    }

    @Nested
    @DisplayName("Status, gaps and digest")
    class MiscTests {

        @Test
        @DisplayName("Status reports every tier and healthy aggregate")
        void status() {
            ServiceStatus status = service.status();

            assertEquals(GeneQueryService.SERVICE_NAME, status.service());
            assertEquals(List.of("curated", "expanded", "genome", "derived"), List.copyOf(status.tiers().keySet()));
            assertTrue(status.tiers().get("derived").available());
            assertEquals(5, status.tiers().get("derived").entries());
            assertEquals(HealthStatus.Status.UP, status.health().status());
            assertEquals(TestSnapshots.LOADED_AT, status.loadedAt());
        }

        @Test
        @DisplayName("Status degrades when a non-curated tier is missing")
        void statusDegraded() {
            holder.swap(TestSnapshots.curatedOnly());

            ServiceStatus status = service.status();

            assertEquals(HealthStatus.Status.DEGRADED, status.health().status());
            assertNull(status.genomeSummary());
            assertEquals(ArtifactStatus.MISSING, status.tiers().get("expanded").artifact());
        }

        @Test
        @DisplayName("Gap report passes through, missing report is unavailable")
        void gaps() {
            assertEquals(List.of("gtex"), service.gaps().get("missing_sources"));

            holder.swap(TestSnapshots.curatedOnly());
            assertThrows(TierUnavailableException.class, () -> service.gaps());
        }

        @Test
        @DisplayName("Provenance audit lists stored blocks")
        void provenance() {
            assertEquals(1, service.provenanceAudit().size());
            holder.swap(ServedSnapshot.empty());
            assertTrue(service.provenanceAudit().isEmpty());
        }

        @Test
        @DisplayName("Digest covers tiers, coverage and top candidates")
        void digest() {
            String digest = service.digest();

            assertTrue(digest.startsWith("# Gene evidence digest (2026-03-01)"));
            assertTrue(digest.contains("| curated | yes | 4 | loaded |"));
            assertTrue(digest.contains("| go | 3 | 75.0% |"));
            assertTrue(digest.contains("| 1 | GRHL3 | 25.8 | 360 | 18 | yes |"));
            assertEquals(LocalDate.of(2026, 3, 1), service.today());
        }

        @Test
        @DisplayName("Digest of an empty snapshot still renders")
        void digestEmpty() {
            holder.swap(ServedSnapshot.empty());

            String digest = service.digest();

            assertTrue(digest.contains("_Curated data not loaded._"));
            assertTrue(digest.contains("_No gap candidates available._"));
        }
    }
}
