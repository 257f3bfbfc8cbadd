package com.gene.evidence.config;

import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeneEvidenceConfig Tests")
class GeneEvidenceConfigTest {

    private static Config config(Map<String, String> values) {
        return new SmallRyeConfigBuilder().withDefaultValues(values).build();
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Defaults match the documented values")
        void defaults() {
            GeneEvidenceConfig config = GeneEvidenceConfig.defaults();

            assertEquals(Path.of("../lacuene"), config.getCuratedPath());
            assertEquals(Path.of("."), config.getWorkspacePath());
            assertTrue(config.isExcludeZincFingers());
            assertEquals(50, config.getDefaultCandidateLimit());
            assertEquals(500, config.getMaxCandidateLimit());
            assertEquals(20, config.getEnrichmentTop());
            assertEquals(Duration.ofMillis(400), config.getRateLimit());
            assertEquals(3, config.getMaxAttempts());
            assertEquals(Duration.ofSeconds(1), config.getBackoff());
            assertEquals(Duration.ofSeconds(15), config.getTimeout());
        }

        @Test
        @DisplayName("Empty MicroProfile config falls back to defaults")
        void emptyConfig() {
            GeneEvidenceConfig config = GeneEvidenceConfig.from(config(Map.of()));
            assertEquals(50, config.getDefaultCandidateLimit());
            assertEquals(1000, config.getCacheMaxSize());
        }
    }

    @Nested
    @DisplayName("MicroProfile Config")
    class FromConfigTests {

        @Test
        @DisplayName("Reads every gene-evidence key")
        void readsKeys() {
            GeneEvidenceConfig config = GeneEvidenceConfig.from(config(Map.of(
                    GeneEvidenceConfig.CURATED_PATH, "/data/lacuene",
                    GeneEvidenceConfig.WORKSPACE_PATH, "/data/workspace",
                    GeneEvidenceConfig.EXCLUDE_ZINC_FINGERS, "false",
                    GeneEvidenceConfig.DEFAULT_CANDIDATE_LIMIT, "25",
                    GeneEvidenceConfig.MAX_CANDIDATE_LIMIT, "100",
                    GeneEvidenceConfig.ENRICHMENT_TOP, "5",
                    GeneEvidenceConfig.ENRICHMENT_RATE_LIMIT, "100",
                    GeneEvidenceConfig.ENRICHMENT_BACKOFF, "250",
                    GeneEvidenceConfig.NCBI_BASE_URL, "http://localhost:9000/eutils")));

            assertEquals(Path.of("/data/lacuene"), config.getCuratedPath());
            assertFalse(config.isExcludeZincFingers());
            assertEquals(25, config.getDefaultCandidateLimit());
            assertEquals(100, config.getMaxCandidateLimit());
            assertEquals(5, config.getEnrichmentTop());
            assertEquals(Duration.ofMillis(100), config.getRateLimit());
            assertEquals(Duration.ofMillis(250), config.getBackoff());
            assertEquals("http://localhost:9000/eutils", config.getNcbiBaseUrl());
            assertEquals(Path.of("/data/workspace/derived/gap_candidates.json"), config.layout().gapCandidates());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Default limit above maximum is rejected")
        void limitsValidated() {
            assertThrows(IllegalArgumentException.class, () -> GeneEvidenceConfig.builder()
                    .defaultCandidateLimit(600)
                    .maxCandidateLimit(500)
                    .build());
        }

        @Test
        @DisplayName("At least one attempt is required")
        void attemptsValidated() {
            assertThrows(IllegalArgumentException.class, () -> GeneEvidenceConfig.builder().maxAttempts(0).build());
        }
    }
}
