package com.gene.evidence.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.core.model.Tier;
import com.gene.evidence.source.GeneUniverseLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link ServedSnapshot} from the artifacts on disk.
 *
 * <p>Never fails: every artifact is read fail-soft, so a missing or malformed file only
 * leaves its own tier empty.</p>
 */
public class SnapshotLoader {
    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private static final TypeReference<Map<String, Map<String, Object>>> CURATED_SOURCES = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private final ArtifactLayout layout;
    private final ArtifactReader reader;
    private final GeneUniverseLoader universeLoader;
    private final ProvenanceScanner provenanceScanner;
    private final Clock clock;

    public SnapshotLoader(ArtifactLayout layout, GeneUniverseLoader universeLoader) {
        this(layout, new ArtifactReader(), universeLoader, new ProvenanceScanner(), Clock.systemUTC());
    }

    public SnapshotLoader(ArtifactLayout layout, ArtifactReader reader, GeneUniverseLoader universeLoader,
                          ProvenanceScanner provenanceScanner, Clock clock) {
        this.layout = layout;
        this.reader = reader;
        this.universeLoader = universeLoader;
        this.provenanceScanner = provenanceScanner;
        this.clock = clock;
    }

    public ServedSnapshot load() {
        log.info("snapshot.loading curatedRoot={} workspaceRoot={}", layout.curatedRoot(), layout.workspaceRoot());

        LoadedArtifact<Map<String, Map<String, Object>>> curated =
                reader.read(layout.curatedSources(), "curated", CURATED_SOURCES, Map.of());
        LoadedArtifact<Map<String, Object>> gaps =
                reader.read(layout.gapReport(), "gaps", OBJECT, Map.of());
        LoadedArtifact<List<GeneRecord>> expanded = universeLoader.load(layout.expandedGenes());
        LoadedArtifact<Map<String, Object>> genome =
                reader.read(layout.genomeWideSummary(), "genome", OBJECT, Map.of());
        LoadedArtifact<CandidateSnapshot> candidates =
                reader.read(layout.gapCandidates(), "derived", CandidateSnapshot.class, null);
        List<ProvenanceAuditEntry> audit = provenanceScanner.scan(layout.derivedDirectory());

        ServedSnapshot snapshot = ServedSnapshot.builder()
                .curatedSources(curated.value(), curated.status())
                .gapReport(gaps.value(), gaps.status())
                .expandedGenes(expanded.value(), expanded.status())
                .genomeSummary(genome.value(), genome.status())
                .candidates(candidates.value(), candidates.status())
                .provenanceAudit(audit)
                .loadedAt(Instant.now(clock))
                .build();

        log.info("snapshot.loaded tiers={}", describe(snapshot));
        return snapshot;
    }

    static String describe(ServedSnapshot snapshot) {
        List<String> parts = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            if (snapshot.isAvailable(tier)) {
                parts.add(tier.getParamName() + "(" + snapshot.size(tier) + ")");
            }
        }
        return parts.isEmpty() ? "no data loaded" : String.join(", ", parts);
    }
}
