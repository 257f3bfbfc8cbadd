package com.gene.evidence.candidate;

import com.gene.evidence.core.model.AggregatedGeneRecord;
import com.gene.evidence.core.model.GeneRecord;
import com.gene.evidence.core.model.Provenance;
import com.gene.evidence.scoring.EvidenceScorer;
import com.gene.evidence.scoring.ScoreBand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selects gap candidates from the aggregated population.
 *
 * <p>Curated genes are skipped regardless of evidence and genes scoring zero are dropped.
 * The result is sorted by score descending with ties broken by symbol ascending, and is
 * wrapped with a score-band histogram and a provenance block.</p>
 */
public class CandidateSelector {
    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    public static final String WORKER = "gene-evidence/gap-derivation";
    public static final List<String> CANON_SOURCES = List.of("HGNC", "HPO", "Orphanet", "OMIM");
    public static final String GROUP_MATCHING_HEURISTIC = "Gene group matching heuristic";
    static final String DESCRIPTION =
            "Genes with disease signal not in curated set, candidates for literature review";

    /**
     * Sort order of a candidate list.
     */
    public static final Comparator<CandidateRecord> ORDER = Comparator
            .comparingDouble(CandidateRecord::confidenceScore).reversed()
            .thenComparing(CandidateRecord::symbol);

    private final EvidenceScorer scorer;
    private final Clock clock;

    public CandidateSelector(EvidenceScorer scorer) {
        this(scorer, Clock.systemUTC());
    }

    public CandidateSelector(EvidenceScorer scorer, Clock clock) {
        this.scorer = scorer;
        this.clock = clock;
    }

    /**
     * Builds the candidate artifact.
     *
     * @param records          every aggregated gene
     * @param exclusionRules   descriptions of the exclusion rules applied to the universe
     */
    public CandidateSnapshot select(List<AggregatedGeneRecord> records, List<String> exclusionRules) {
        List<CandidateRecord> candidates = new ArrayList<>();
        int curated = 0;
        int zeroScore = 0;
        for (AggregatedGeneRecord record : records) {
            if (record.curated()) {
                curated++;
                continue;
            }
            double score = scorer.score(record);
            if (score <= 0.0) {
                zeroScore++;
                continue;
            }
            candidates.add(toCandidate(record, score));
        }
        candidates.sort(ORDER);

        Map<String, Integer> distribution = distribution(candidates);
        CandidateSnapshot snapshot = new CandidateSnapshot(
                provenance(exclusionRules),
                curated,
                records.size(),
                candidates.size(),
                distribution,
                candidates);

        log.info("selection.completed candidates={} curatedSkipped={} zeroScore={} distribution={}",
                candidates.size(), curated, zeroScore, distribution);
        return snapshot;
    }

    /**
     * Histogram of candidates per score band, in band order, including empty bands.
     */
    public static Map<String, Integer> distribution(List<CandidateRecord> candidates) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ScoreBand band : ScoreBand.values()) {
            counts.put(band.getLabel(), 0);
        }
        for (CandidateRecord candidate : candidates) {
            counts.merge(ScoreBand.of(candidate.confidenceScore()).getLabel(), 1, Integer::sum);
        }
        return counts;
    }

    private CandidateRecord toCandidate(AggregatedGeneRecord record, double score) {
        GeneRecord gene = record.gene();
        return new CandidateRecord(
                record.symbol(),
                gene.name(),
                gene.source(),
                gene.geneGroups(),
                gene.location(),
                score,
                EvidenceBreakdown.of(record),
                record.crossReferences());
    }

    private Provenance provenance(List<String> exclusionRules) {
        Provenance.Builder builder = Provenance.builder()
                .worker(WORKER)
                .generated(Instant.now(clock))
                .canonSources(CANON_SOURCES)
                .nonCanonElement(scorer.describe());
        if (exclusionRules != null) {
            exclusionRules.forEach(builder::nonCanonElement);
        }
        return builder
                .nonCanonElement(GROUP_MATCHING_HEURISTIC)
                .description(DESCRIPTION)
                .build();
    }
}
