package com.gene.evidence.scoring;

/**
 * Weights of the logarithmic evidence score.
 *
 * <p>The formula has changed across revisions more than any other constant in the system;
 * it is kept in this one value so a change touches a single place.</p>
 *
 * @param phenotypeWeight   multiplier on log2(phenotype terms + 1)
 * @param rareDiseaseWeight multiplier on log2(rare disease associations + 1)
 * @param diseaseEntryBase  flat contribution of having a disease entry at all
 */
public record ScoringWeights(
        double phenotypeWeight,
        double rareDiseaseWeight,
        double diseaseEntryBase
) {
    public ScoringWeights {
        if (phenotypeWeight < 0 || rareDiseaseWeight < 0 || diseaseEntryBase < 0) {
            throw new IllegalArgumentException("Scoring weights must be non-negative");
        }
    }

    public static ScoringWeights canonical() {
        return new ScoringWeights(1.0, 3.0, 2.0);
    }
}
