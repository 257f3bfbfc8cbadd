package com.gene.evidence.api;

import com.gene.evidence.candidate.CandidateRecord;
import com.gene.evidence.candidate.CandidateSelector;
import com.gene.evidence.candidate.CandidateSnapshot;
import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.core.model.GeneSymbol;
import com.gene.evidence.core.model.Tier;
import com.gene.evidence.health.HealthCheckRegistry;
import com.gene.evidence.health.HealthStatus;
import com.gene.evidence.metrics.NoOpPipelineMetrics;
import com.gene.evidence.metrics.PipelineMetrics;
import com.gene.evidence.snapshot.ProvenanceAuditEntry;
import com.gene.evidence.snapshot.ServedSnapshot;
import com.gene.evidence.snapshot.ServedSnapshotHolder;
import com.gene.evidence.tier.TierResolution;
import com.gene.evidence.tier.TierResolver;
import com.gene.evidence.tier.TierUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries over the served snapshot.
 *
 * <p>Every operation reads the current snapshot once and answers from memory. Parameters
 * arrive as raw strings and are validated before any data is touched; failures surface as
 * {@link InvalidQueryException}, {@link GeneNotFoundException} or
 * {@link TierUnavailableException}.</p>
 */
public class GeneQueryService {
    private static final Logger log = LoggerFactory.getLogger(GeneQueryService.class);

    public static final String SERVICE_NAME = "gene-evidence";
    public static final String DEFAULT_TIER = "curated";

    /**
     * Sources tracked by the curated pipeline; each has an {@code in_<source>} flag per gene.
     */
    public static final List<String> COVERAGE_SOURCES = List.of(
            "go", "omim", "hpo", "uniprot", "facebase", "clinvar",
            "pubmed", "gnomad", "nih_reporter", "gtex", "clinicaltrials",
            "string", "orphanet", "opentargets", "models", "structures");

    private static final String GAPS_HINT = "Run the curated pipeline (just generate) to produce output/gap_report.json";

    private final ServedSnapshotHolder holder;
    private final TierResolver resolver;
    private final HealthCheckRegistry health;
    private final PipelineMetrics metrics;
    private final int defaultCandidateLimit;
    private final int maxCandidateLimit;
    private final Clock clock;

    public GeneQueryService(ServedSnapshotHolder holder, int defaultCandidateLimit, int maxCandidateLimit) {
        this(holder, new TierResolver(), new HealthCheckRegistry(), new NoOpPipelineMetrics(),
                defaultCandidateLimit, maxCandidateLimit, Clock.systemUTC());
    }

    public GeneQueryService(ServedSnapshotHolder holder, TierResolver resolver, HealthCheckRegistry health,
                            PipelineMetrics metrics, int defaultCandidateLimit, int maxCandidateLimit,
                            Clock clock) {
        this.holder = holder;
        this.resolver = resolver;
        this.health = health;
        this.metrics = metrics;
        this.defaultCandidateLimit = defaultCandidateLimit;
        this.maxCandidateLimit = maxCandidateLimit;
        this.clock = clock;
    }

    /**
     * Lists the genes of a tier, falling back along the tier's chain when it is empty.
     *
     * @param tierParam one of {@link Tier#listableNames()}; null or blank means curated
     */
    public GeneListResult listGenes(String tierParam) {
        String name = tierParam == null || tierParam.isBlank() ? DEFAULT_TIER : tierParam;
        Tier requested = Tier.fromParam(name)
                .filter(Tier::isListable)
                .orElseThrow(() -> new InvalidQueryException("Unknown tier: " + name, Tier.listableNames()));

        ServedSnapshot snapshot = holder.current();
        TierResolution resolution = resolve(requested, snapshot);

        GeneListResult result = switch (resolution.served()) {
            case CURATED -> new GeneListResult(resolution, snapshot.size(Tier.CURATED),
                    snapshot.getCuratedSymbols(), null);
            case EXPANDED -> new GeneListResult(resolution, snapshot.size(Tier.EXPANDED),
                    snapshot.getExpandedGenes().stream().map(GeneRecord::symbol).toList(), null);
            case GENOME -> new GeneListResult(resolution, 0, List.of(), snapshot.getGenomeSummary());
            case DERIVED -> throw new IllegalStateException("Derived tier is not listable");
        };
        if (resolution.isFallback()) {
            log.info("query.fallback requested={} served={}", requested, resolution.served());
        }
        return result;
    }

    /**
     * Looks a gene up in the curated tier, then in the expanded tier.
     * Requires curated data to be loaded even when the gene would be found in the expanded list.
     */
    public GeneDetail geneDetail(String symbol) {
        String normalized = GeneSymbol.normalize(symbol);
        if (normalized == null || normalized.isEmpty()) {
            throw new InvalidQueryException("Gene symbol is required");
        }

        ServedSnapshot snapshot = holder.current();
        resolve(Tier.CURATED, snapshot);

        Optional<Map<String, Object>> curated = snapshot.findCurated(normalized);
        Optional<GeneRecord> expanded = snapshot.findExpanded(normalized);
        if (curated.isPresent()) {
            return new GeneDetail(normalized, Tier.CURATED, curated.get(), expanded.orElse(null), null);
        }
        if (expanded.isPresent()) {
            return new GeneDetail(normalized, Tier.EXPANDED, null, expanded.get(), GeneDetail.UNCURATED_NOTE);
        }
        throw new GeneNotFoundException(normalized);
    }

    /**
     * Per-source count and percentage over the curated population.
     */
    public CoverageSummary coverage() {
        ServedSnapshot snapshot = holder.current();
        resolve(Tier.CURATED, snapshot);

        Collection<Map<String, Object>> genes = snapshot.getCuratedSources().values();
        int total = genes.size();
        Map<String, SourceCoverage> sources = new LinkedHashMap<>();
        for (String source : COVERAGE_SOURCES) {
            String flag = flagName(source);
            int count = (int) genes.stream().filter(g -> isTruthy(g.get(flag))).count();
            sources.put(source, SourceCoverage.of(count, total));
        }
        return new CoverageSummary(total, sources);
    }

    /**
     * Boolean source flags per curated gene.
     */
    public CoverageMatrix coverageMatrix() {
        ServedSnapshot snapshot = holder.current();
        resolve(Tier.CURATED, snapshot);

        Map<String, Map<String, Boolean>> rows = new LinkedHashMap<>();
        Map<String, Integer> totals = new LinkedHashMap<>();
        COVERAGE_SOURCES.forEach(source -> totals.put(source, 0));
        snapshot.getCuratedSources().forEach((symbol, flags) -> {
            Map<String, Boolean> row = new LinkedHashMap<>();
            for (String source : COVERAGE_SOURCES) {
                boolean covered = isTruthy(flags.get(flagName(source)));
                row.put(source, covered);
                if (covered) {
                    totals.merge(source, 1, Integer::sum);
                }
            }
            rows.put(symbol, row);
        });
        return new CoverageMatrix(COVERAGE_SOURCES, rows, totals);
    }

    /**
     * Candidates at or above {@code minScore}, at most {@code limit} of them, in stored order.
     * The stored scores are returned as-is; nothing is re-scored.
     *
     * @param minScoreParam non-negative integer; null or blank means 0
     * @param limitParam    positive integer; null or blank means the configured default,
     *                      values above the configured maximum are capped
     */
    public CandidatePage candidates(String minScoreParam, String limitParam) {
        double minScore = parseMinScore(minScoreParam);
        int limit = parseLimit(limitParam);

        ServedSnapshot snapshot = holder.current();
        resolve(Tier.DERIVED, snapshot);
        CandidateSnapshot artifact = snapshot.getCandidates().orElseThrow();

        List<CandidateRecord> matching = artifact.candidates().stream()
                .filter(c -> c.confidenceScore() >= minScore)
                .toList();
        List<CandidateRecord> page = matching.size() > limit ? matching.subList(0, limit) : matching;

        Map<String, Integer> distribution = artifact.scoreDistribution().isEmpty()
                ? CandidateSelector.distribution(artifact.candidates())
                : artifact.scoreDistribution();
        return new CandidatePage(artifact.provenance(), artifact.candidateCount(), matching.size(),
                distribution, minScore, limit, page);
    }

    /**
     * Provenance blocks of all derived artifacts. Never unavailable: an empty list when none exist.
     */
    public List<ProvenanceAuditEntry> provenanceAudit() {
        return holder.current().getProvenanceAudit();
    }

    /**
     * Curated gap report, passed through unchanged.
     */
    public Map<String, Object> gaps() {
        ServedSnapshot snapshot = holder.current();
        if (snapshot.getGapReport().isEmpty()) {
            throw new TierUnavailableException(Tier.CURATED, "Gap report not available", GAPS_HINT);
        }
        return snapshot.getGapReport();
    }

    public ServiceStatus status() {
        ServedSnapshot snapshot = holder.current();
        Map<String, TierAvailability> tiers = new LinkedHashMap<>();
        for (Tier tier : Tier.values()) {
            tiers.put(tier.getParamName(), new TierAvailability(
                    snapshot.isAvailable(tier), snapshot.size(tier), snapshot.getStatus(tier)));
        }
        HealthStatus aggregate = health.checkAll();
        return new ServiceStatus(SERVICE_NAME, tiers,
                snapshot.isAvailable(Tier.GENOME) ? snapshot.getGenomeSummary() : null,
                aggregate, snapshot.getLoadedAt());
    }

    /**
     * Markdown digest of tier availability, source coverage and top candidates.
     */
    public String digest() {
        ServedSnapshot snapshot = holder.current();
        CoverageSummary coverage = snapshot.isAvailable(Tier.CURATED) ? coverage() : null;
        return new DigestRenderer().render(today(), snapshot, coverage);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private TierResolution resolve(Tier requested, ServedSnapshot snapshot) {
        try {
            TierResolution resolution = resolver.resolve(requested, snapshot);
            metrics.incrementTierQuery(requested, resolution.served());
            return resolution;
        } catch (TierUnavailableException e) {
            metrics.incrementTierUnavailable(requested);
            throw e;
        }
    }

    private double parseMinScore(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("min_score must be an integer, got '" + value + "'");
        }
        if (parsed < 0) {
            throw new InvalidQueryException("min_score must be >= 0, got '" + value + "'");
        }
        return parsed;
    }

    private int parseLimit(String value) {
        if (value == null || value.isBlank()) {
            return defaultCandidateLimit;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("limit must be an integer, got '" + value + "'");
        }
        if (parsed <= 0) {
            throw new InvalidQueryException("limit must be > 0, got '" + value + "'");
        }
        return Math.min(parsed, maxCandidateLimit);
    }

    static String flagName(String source) {
        return "in_" + source;
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }
}
