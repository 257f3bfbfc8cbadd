package com.gene.evidence.scoring;

/**
 * Confidence bands used for the candidate score histogram.
 */
public enum ScoreBand {
    HIGH("high (12+)", 12.0),
    MEDIUM("medium (6-11.9)", 6.0),
    LOW("low (<6)", 0.0);

    private final String label;
    private final double lowerBound;

    ScoreBand(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    public String getLabel() {
        return label;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public static ScoreBand of(double score) {
        if (score >= HIGH.lowerBound) {
            return HIGH;
        }
        if (score >= MEDIUM.lowerBound) {
            return MEDIUM;
        }
        return LOW;
    }
}
