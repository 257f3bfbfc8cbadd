package com.gene.evidence.api;

/**
 * How many curated genes one source covers.
 */
public record SourceCoverage(int count, int total, double percent) {

    public static SourceCoverage of(int count, int total) {
        double percent = total > 0 ? Math.round(1000.0 * count / total) / 10.0 : 0.0;
        return new SourceCoverage(count, total, percent);
    }
}
