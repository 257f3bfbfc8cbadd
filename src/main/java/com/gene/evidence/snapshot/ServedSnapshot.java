package com.gene.evidence.snapshot;

import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.core.model.GeneSymbol;
import com.gene.evidence.core.model.Tier;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Everything the serving layer answers from, loaded once and never mutated.
 *
 * <p>Each tier is independent: one being missing or malformed leaves the others intact.
 * The curated and expanded tiers are <em>available</em> when they hold at least one gene;
 * an empty but well-formed gene list is treated like a missing one. The genome and derived
 * tiers are available whenever their artifact loaded, even with zero entries.</p>
 */
public final class ServedSnapshot {

    private final Map<String, Map<String, Object>> curatedSources;
    private final Map<String, Object> gapReport;
    private final List<GeneRecord> expandedGenes;
    private final Map<String, GeneRecord> expandedBySymbol;
    private final Map<String, Object> genomeSummary;
    private final CandidateSnapshot candidates;
    private final List<ProvenanceAuditEntry> provenanceAudit;
    private final Map<Tier, ArtifactStatus> tierStatus;
    private final ArtifactStatus gapReportStatus;
    private final Instant loadedAt;

    private ServedSnapshot(Builder builder) {
        Map<String, Map<String, Object>> sources = new TreeMap<>();
        builder.curatedSources.forEach((symbol, flags) -> sources.put(GeneSymbol.normalize(symbol),
                flags != null ? Collections.unmodifiableMap(new LinkedHashMap<>(flags)) : Map.of()));
        this.curatedSources = Collections.unmodifiableMap(sources);
        this.gapReport = Collections.unmodifiableMap(new LinkedHashMap<>(builder.gapReport));
        this.expandedGenes = List.copyOf(builder.expandedGenes);
        Map<String, GeneRecord> bySymbol = new LinkedHashMap<>();
        for (GeneRecord gene : expandedGenes) {
            bySymbol.putIfAbsent(gene.symbol(), gene);
        }
        this.expandedBySymbol = Collections.unmodifiableMap(bySymbol);
        this.genomeSummary = Collections.unmodifiableMap(new LinkedHashMap<>(builder.genomeSummary));
        this.candidates = builder.candidates;
        this.provenanceAudit = List.copyOf(builder.provenanceAudit);
        EnumMap<Tier, ArtifactStatus> statuses = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            statuses.put(tier, builder.tierStatus.getOrDefault(tier, ArtifactStatus.MISSING));
        }
        this.tierStatus = Collections.unmodifiableMap(statuses);
        this.gapReportStatus = builder.gapReportStatus;
        this.loadedAt = builder.loadedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ServedSnapshot empty() {
        return builder().build();
    }

    /**
     * Curated source flags keyed by symbol, in symbol order.
     */
    public Map<String, Map<String, Object>> getCuratedSources() {
        return curatedSources;
    }

    public List<String> getCuratedSymbols() {
        return List.copyOf(curatedSources.keySet());
    }

    public Optional<Map<String, Object>> findCurated(String symbol) {
        return Optional.ofNullable(curatedSources.get(GeneSymbol.normalize(symbol)));
    }

    public Map<String, Object> getGapReport() {
        return gapReport;
    }

    public ArtifactStatus getGapReportStatus() {
        return gapReportStatus;
    }

    /**
     * Expanded genes after exclusion rules, in file order.
     */
    public List<GeneRecord> getExpandedGenes() {
        return expandedGenes;
    }

    public Optional<GeneRecord> findExpanded(String symbol) {
        return Optional.ofNullable(expandedBySymbol.get(GeneSymbol.normalize(symbol)));
    }

    public Map<String, Object> getGenomeSummary() {
        return genomeSummary;
    }

    public Optional<CandidateSnapshot> getCandidates() {
        return Optional.ofNullable(candidates);
    }

    public List<ProvenanceAuditEntry> getProvenanceAudit() {
        return provenanceAudit;
    }

    public ArtifactStatus getStatus(Tier tier) {
        return tierStatus.get(tier);
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public boolean isAvailable(Tier tier) {
        return switch (tier) {
            case CURATED, EXPANDED -> size(tier) > 0;
            case GENOME -> tierStatus.get(Tier.GENOME).isUsable();
            case DERIVED -> candidates != null && tierStatus.get(Tier.DERIVED).isUsable();
        };
    }

    /**
     * Number of entries backing the tier: genes for curated and expanded, summary fields
     * for genome, candidates for derived.
     */
    public int size(Tier tier) {
        return switch (tier) {
            case CURATED -> curatedSources.size();
            case EXPANDED -> expandedGenes.size();
            case GENOME -> genomeSummary.size();
            case DERIVED -> candidates != null ? candidates.candidates().size() : 0;
        };
    }

    public static class Builder {
        private Map<String, Map<String, Object>> curatedSources = Map.of();
        private Map<String, Object> gapReport = Map.of();
        private List<GeneRecord> expandedGenes = List.of();
        private Map<String, Object> genomeSummary = Map.of();
        private CandidateSnapshot candidates;
        private List<ProvenanceAuditEntry> provenanceAudit = List.of();
        private final Map<Tier, ArtifactStatus> tierStatus = new EnumMap<>(Tier.class);
        private ArtifactStatus gapReportStatus = ArtifactStatus.MISSING;
        private Instant loadedAt = Instant.now();

        public Builder curatedSources(Map<String, Map<String, Object>> curatedSources, ArtifactStatus status) {
            this.curatedSources = Objects.requireNonNullElse(curatedSources, Map.of());
            this.tierStatus.put(Tier.CURATED, status);
            return this;
        }

        public Builder gapReport(Map<String, Object> gapReport, ArtifactStatus status) {
            this.gapReport = Objects.requireNonNullElse(gapReport, Map.of());
            this.gapReportStatus = status;
            return this;
        }

        public Builder expandedGenes(List<GeneRecord> expandedGenes, ArtifactStatus status) {
            this.expandedGenes = Objects.requireNonNullElse(expandedGenes, List.of());
            this.tierStatus.put(Tier.EXPANDED, status);
            return this;
        }

        public Builder genomeSummary(Map<String, Object> genomeSummary, ArtifactStatus status) {
            this.genomeSummary = Objects.requireNonNullElse(genomeSummary, Map.of());
            this.tierStatus.put(Tier.GENOME, status);
            return this;
        }

        public Builder candidates(CandidateSnapshot candidates, ArtifactStatus status) {
            this.candidates = candidates;
            this.tierStatus.put(Tier.DERIVED, status);
            return this;
        }

        public Builder provenanceAudit(List<ProvenanceAuditEntry> provenanceAudit) {
            this.provenanceAudit = Objects.requireNonNullElse(provenanceAudit, List.of());
            return this;
        }

        public Builder loadedAt(Instant loadedAt) {
            this.loadedAt = loadedAt;
            return this;
        }

        public ServedSnapshot build() {
            return new ServedSnapshot(this);
        }
    }
}
