package com.gene.evidence.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.snapshot.ArtifactReader;
import com.gene.evidence.snapshot.LoadedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the expanded gene list and applies exclusion rules.
 * Records without a symbol are dropped.
 */
public class GeneUniverseLoader {
    private static final Logger log = LoggerFactory.getLogger(GeneUniverseLoader.class);
    private static final TypeReference<List<GeneRecord>> GENE_LIST = new TypeReference<>() {};

    private final ArtifactReader reader;
    private final List<ExclusionRule> rules;

    public GeneUniverseLoader(List<ExclusionRule> rules) {
        this(new ArtifactReader(), rules);
    }

    public GeneUniverseLoader(ArtifactReader reader, List<ExclusionRule> rules) {
        this.reader = reader;
        this.rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public LoadedArtifact<List<GeneRecord>> load(Path path) {
        LoadedArtifact<List<GeneRecord>> raw = reader.read(path, "expanded", GENE_LIST, List.of());
        if (!raw.status().isUsable()) {
            return raw;
        }
        List<GeneRecord> filtered = apply(raw.value());
        return LoadedArtifact.loaded(path, filtered);
    }

    public List<GeneRecord> apply(List<GeneRecord> genes) {
        List<GeneRecord> kept = new ArrayList<>(genes.size());
        int excluded = 0;
        for (GeneRecord gene : genes) {
            if (gene == null || gene.symbol() == null || gene.symbol().isEmpty()) {
                continue;
            }
            if (rules.stream().anyMatch(rule -> rule.excludes(gene))) {
                excluded++;
                continue;
            }
            kept.add(gene);
        }
        log.info("universe.filtered kept={} excluded={} rules={}", kept.size(), excluded, describeRules());
        return List.copyOf(kept);
    }

    public List<String> describeRules() {
        return rules.stream().map(ExclusionRule::describe).toList();
    }
}
