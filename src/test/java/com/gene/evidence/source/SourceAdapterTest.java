package com.gene.evidence.source;

import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.SourceEvidence;
import com.gene.evidence.snapshot.ArtifactLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Source Adapter Tests")
class SourceAdapterTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Missing files")
    class MissingFileTests {

        @Test
        @DisplayName("Every adapter returns an empty map for a missing file")
        void missingFileIsEmpty() {
            Path missing = tempDir.resolve("does-not-exist");
            List<SourceAdapter> adapters = List.of(
                    new HpoPhenotypeAdapter(missing),
                    new OrphanetAdapter(missing),
                    new OmimSubsetAdapter(missing),
                    new CuratedSourcesAdapter(missing));

            for (SourceAdapter adapter : adapters) {
                assertTrue(adapter.load().isEmpty(), adapter.getSource() + " should be empty");
            }
        }
    }

    @Nested
    @DisplayName("HpoPhenotypeAdapter")
    class HpoTests {

        @Test
        @DisplayName("Collects distinct sorted terms per symbol, skipping comments and short lines")
        void parsesTsv() throws IOException {
            Path file = write("genes_to_phenotype.txt", String.join("\n",
                    "#ncbi_gene_id\tgene_symbol\thpo_id\thpo_name\tfrequency",
                    "3664\tIRF6\tHP:0000175\tCleft palate\t-",
                    "3664\tIRF6\tHP:0000204\tCleft upper lip\t-",
                    "3664\tirf6\tHP:0000175\tCleft palate\t-",
                    "4487\tMSX1\tHP:0000668\tHypodontia\t-",
                    "broken\tline",
                    ""));

            Map<String, SourceEvidence> result = new HpoPhenotypeAdapter(file).load();

            assertEquals(2, result.size());
            SourceEvidence irf6 = result.get("IRF6");
            assertEquals(2, irf6.count());
            assertEquals(List.of("Cleft palate", "Cleft upper lip"), irf6.details());
            assertEquals(EvidenceSource.HPO, irf6.source());
            assertEquals(1, result.get("MSX1").count());
        }
    }

    @Nested
    @DisplayName("OrphanetAdapter")
    class OrphanetTests {

        @Test
        @DisplayName("Accepts both list and object-with-disorders shapes")
        void acceptsBothShapes() throws IOException {
            Path file = write("orphanet_cache.json", """
                    {
                      "TCOF1": [{"name": "Treacher Collins syndrome"}, "Mandibulofacial dysostosis"],
                      "POLR1D": {"disorders": [{"name": "Treacher Collins syndrome"}]},
                      "EMPTY1": {"other": 1}
                    }
                    """);

            Map<String, SourceEvidence> result = new OrphanetAdapter(file).load();

            assertEquals(2, result.get("TCOF1").count());
            assertEquals(List.of("Treacher Collins syndrome", "Mandibulofacial dysostosis"),
                    result.get("TCOF1").details());
            assertEquals(1, result.get("POLR1D").count());
            assertFalse(result.get("EMPTY1").present());
        }

        @Test
        @DisplayName("Malformed JSON fails the load")
        void malformedFails() throws IOException {
            Path file = write("orphanet_cache.json", "{\"TCOF1\": [");
            ArtifactLoadException e = assertThrows(ArtifactLoadException.class, () -> new OrphanetAdapter(file).load());
            assertEquals(file, e.getPath());
        }
    }

    @Nested
    @DisplayName("OmimSubsetAdapter")
    class OmimTests {

        @Test
        @DisplayName("Reads title and syndromes, skipping empty entries")
        void readsEntries() throws IOException {
            Path file = write("omim_subset.json", """
                    {"genes": {
                      "IRF6": {"title": "Interferon regulatory factor 6",
                               "syndromes": ["Van der Woude syndrome 1", "Popliteal pterygium syndrome 1"]},
                      "GRHL3": {"title": "Grainyhead-like 3"},
                      "NONE1": {}
                    }}
                    """);

            Map<String, SourceEvidence> result = new OmimSubsetAdapter(file).load();

            assertEquals(2, result.size());
            assertEquals(2, result.get("IRF6").count());
            assertEquals("Interferon regulatory factor 6", result.get("IRF6").label());
            assertTrue(result.get("GRHL3").present());
            assertEquals(0, result.get("GRHL3").count());
            assertFalse(result.containsKey("NONE1"));
        }

        @Test
        @DisplayName("Document without a genes object yields nothing")
        void noGenesObject() throws IOException {
            Path file = write("omim_subset.json", "{\"version\": 2}");
            assertTrue(new OmimSubsetAdapter(file).load().isEmpty());
        }
    }

    @Nested
    @DisplayName("CuratedSourcesAdapter")
    class CuratedTests {

        @Test
        @DisplayName("Counts truthy coverage flags per gene")
        void countsTruthyFlags() throws IOException {
            Path file = write("sources.json", """
                    {
                      "IRF6": {"in_go": true, "in_hpo": true, "in_omim": false, "pubmed_count": 12},
                      "msx1": {"in_go": false, "in_hpo": 0, "notes": ""}
                    }
                    """);

            Map<String, SourceEvidence> result = new CuratedSourcesAdapter(file).load();

            assertEquals(List.of("in_go", "in_hpo", "pubmed_count"), result.get("IRF6").details());
            assertEquals(3, result.get("IRF6").count());
            assertTrue(result.containsKey("MSX1"));
            assertEquals(0, result.get("MSX1").count());
        }
    }

    @Nested
    @DisplayName("GeneUniverseLoader")
    class UniverseTests {

        @Test
        @DisplayName("Zinc finger rule drops C2H2 genes and describes itself")
        void zincFingerExcluded() throws IOException {
            Path file = write("hgnc_craniofacial.json", """
                    [
                      {"symbol": "ZNF141", "source": "group:Zinc fingers C2H2-type"},
                      {"symbol": "GRHL3", "source": "group:Grainyhead like transcription factors"},
                      {"symbol": "", "source": "name:broken"},
                      {"symbol": "irf6", "source": "curated"}
                    ]
                    """);
            GeneUniverseLoader loader = new GeneUniverseLoader(List.of(new ZincFingerExclusionRule()));

            var loaded = loader.load(file);

            assertEquals(List.of("GRHL3", "IRF6"), loaded.value().stream().map(g -> g.symbol()).toList());
            assertEquals(List.of("ZNF exclusion rule"), loader.describeRules());
        }

        @Test
        @DisplayName("Without rules every named gene is kept")
        void noRules() throws IOException {
            Path file = write("hgnc_craniofacial.json", """
                    [{"symbol": "ZNF141", "source": "group:Zinc fingers C2H2-type"}]
                    """);
            assertEquals(1, new GeneUniverseLoader(List.of()).load(file).value().size());
        }
    }
}
