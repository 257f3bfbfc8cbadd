package com.gene.evidence.batch;

import com.gene.evidence.aggregate.EvidenceAggregator;
import com.gene.evidence.core.model.AggregatedGeneRecord;
import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.core.model.SourceEvidence;
import com.gene.evidence.snapshot.ArtifactLayout;
import com.gene.evidence.snapshot.ArtifactLoadException;
import com.gene.evidence.snapshot.ArtifactStatus;
import com.gene.evidence.snapshot.LoadedArtifact;
import com.gene.evidence.source.CuratedSourcesAdapter;
import com.gene.evidence.source.ExclusionRule;
import com.gene.evidence.source.GeneUniverseLoader;
import com.gene.evidence.source.HpoPhenotypeAdapter;
import com.gene.evidence.source.OmimSubsetAdapter;
import com.gene.evidence.source.OrphanetAdapter;
import com.gene.evidence.source.SourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the gene universe and every source adapter and joins them.
 *
 * <p>Source files that are absent contribute nothing. A universe or source file that exists
 * but cannot be parsed fails the run, so the previous artifacts stay in place.</p>
 */
public class EvidenceAssembler {
    private static final Logger log = LoggerFactory.getLogger(EvidenceAssembler.class);

    private final Path universePath;
    private final GeneUniverseLoader universeLoader;
    private final List<SourceAdapter> adapters;
    private final EvidenceAggregator aggregator;

    public EvidenceAssembler(Path universePath, GeneUniverseLoader universeLoader,
                             List<SourceAdapter> adapters, EvidenceAggregator aggregator) {
        this.universePath = universePath;
        this.universeLoader = universeLoader;
        this.adapters = List.copyOf(adapters);
        this.aggregator = aggregator;
    }

    /**
     * Standard wiring over the artifact layout: HPO, Orphanet, OMIM and curated coverage.
     */
    public static EvidenceAssembler forLayout(ArtifactLayout layout, List<ExclusionRule> rules) {
        return new EvidenceAssembler(
                layout.expandedGenes(),
                new GeneUniverseLoader(rules),
                List.of(
                        new HpoPhenotypeAdapter(layout.hpoPhenotypes()),
                        new OrphanetAdapter(layout.orphanetCache()),
                        new OmimSubsetAdapter(layout.omimSubset()),
                        new CuratedSourcesAdapter(layout.curatedSources())),
                new EvidenceAggregator());
    }

    public AssembledEvidence assemble() {
        LoadedArtifact<List<GeneRecord>> universe = universeLoader.load(universePath);
        if (universe.status() == ArtifactStatus.MALFORMED) {
            throw new ArtifactLoadException(universePath, "Expanded gene list is malformed: " + universe.error(), null);
        }
        if (universe.value().isEmpty()) {
            throw new IllegalStateException("Expanded gene list is empty or missing at " + universePath
                    + ". Run the gene expansion step first.");
        }

        Map<EvidenceSource, Map<String, SourceEvidence>> evidence = new EnumMap<>(EvidenceSource.class);
        for (SourceAdapter adapter : adapters) {
            evidence.put(adapter.getSource(), adapter.load());
        }
        Map<String, SourceEvidence> curated = evidence.getOrDefault(EvidenceSource.CURATED_PIPELINE, Map.of());

        List<AggregatedGeneRecord> records = aggregator.aggregate(universe.value(), curated.keySet(), evidence);
        log.info("assembly.completed universe={} curated={} records={}",
                universe.value().size(), curated.size(), records.size());
        return new AssembledEvidence(records, universe.value().size(), curated.size(),
                universeLoader.describeRules());
    }
}
