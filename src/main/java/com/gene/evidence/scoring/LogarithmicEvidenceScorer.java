package com.gene.evidence.scoring;

import com.gene.evidence.core.model.AggregatedGeneRecord;
import com.gene.evidence.core.model.EvidenceSource;
import com.gene.evidence.core.model.SourceEvidence;

import java.util.Locale;

/**
 * Logarithmic confidence score:
 *
 * <pre>
 * score = w_hpo * log2(hpo + 1)
 *       + w_orpha * log2(orphanet + 1)
 *       + (base + log2(omim_syndromes + 1))   only when an OMIM entry exists
 * </pre>
 *
 * rounded to one decimal. Each term is zero when its evidence is absent, and every term is
 * non-decreasing in its count, so the total is monotonic in each dimension. Rare-disease
 * associations carry the largest per-unit weight.
 */
public class LogarithmicEvidenceScorer implements EvidenceScorer {

    private final ScoringWeights weights;

    public LogarithmicEvidenceScorer() {
        this(ScoringWeights.canonical());
    }

    public LogarithmicEvidenceScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    @Override
    public double score(AggregatedGeneRecord record) {
        return breakdown(record).total();
    }

    @Override
    public ScoreBreakdown breakdown(AggregatedGeneRecord record) {
        SourceEvidence omim = record.evidence(EvidenceSource.OMIM);
        return compute(
                record.evidence(EvidenceSource.HPO).count(),
                record.evidence(EvidenceSource.ORPHANET).count(),
                omim.present(),
                omim.count());
    }

    /**
     * Scores raw counts directly.
     */
    public double score(int phenotypeCount, int rareDiseaseCount, boolean hasDiseaseEntry, int syndromeCount) {
        return compute(phenotypeCount, rareDiseaseCount, hasDiseaseEntry, syndromeCount).total();
    }

    private ScoreBreakdown compute(int phenotypeCount, int rareDiseaseCount,
                                   boolean hasDiseaseEntry, int syndromeCount) {
        double phenotype = phenotypeCount > 0 ? weights.phenotypeWeight() * log2(phenotypeCount + 1) : 0.0;
        double rareDisease = rareDiseaseCount > 0 ? weights.rareDiseaseWeight() * log2(rareDiseaseCount + 1) : 0.0;
        double diseaseEntry = hasDiseaseEntry
                ? weights.diseaseEntryBase() + log2(Math.max(syndromeCount, 0) + 1)
                : 0.0;
        double total = round1(phenotype + rareDisease + diseaseEntry);
        return new ScoreBreakdown(phenotype, rareDisease, diseaseEntry, total);
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT,
                "Confidence scoring formula: %s*log2(hpo+1) + %s*log2(orphanet+1) + (%s + log2(omim_syndromes+1) if OMIM entry)",
                trim(weights.phenotypeWeight()), trim(weights.rareDiseaseWeight()), trim(weights.diseaseEntryBase()));
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static String trim(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
