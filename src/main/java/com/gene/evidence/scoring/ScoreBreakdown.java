package com.gene.evidence.scoring;

/**
 * Per-term contributions of a score, before rounding of the total.
 */
public record ScoreBreakdown(
        double phenotypeTerm,
        double rareDiseaseTerm,
        double diseaseEntryTerm,
        double total
) {
    public static ScoreBreakdown zero() {
        return new ScoreBreakdown(0.0, 0.0, 0.0, 0.0);
    }
}
