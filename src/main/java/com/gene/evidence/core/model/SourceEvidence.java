package com.gene.evidence.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Evidence contributed by one source for one gene, reduced to a single tagged shape:
 * a presence flag, a count, the detail values behind the count and an optional label
 * (for example the OMIM entry title).
 *
 * <p>Sources with presence semantics (OMIM) may be present with a count of zero.
 * Count-only sources are present exactly when their count is positive.</p>
 */
public record SourceEvidence(
        EvidenceSource source,
        boolean present,
        int count,
        List<String> details,
        String label
) {
    public SourceEvidence {
        Objects.requireNonNull(source, "source is required");
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got " + count);
        }
        details = details != null ? List.copyOf(details) : List.of();
        label = label != null ? label : "";
    }

    /**
     * No evidence from the given source.
     */
    public static SourceEvidence empty(EvidenceSource source) {
        return new SourceEvidence(source, false, 0, List.of(), "");
    }

    /**
     * Count-only evidence: the count is the number of details.
     */
    public static SourceEvidence counted(EvidenceSource source, List<String> details) {
        List<String> values = details != null ? details : List.of();
        return new SourceEvidence(source, !values.isEmpty(), values.size(), values, "");
    }

    /**
     * Presence evidence: an entry exists, with zero or more sub-entries.
     */
    public static SourceEvidence entry(EvidenceSource source, String label, List<String> subEntries) {
        List<String> values = subEntries != null ? subEntries : List.of();
        return new SourceEvidence(source, true, values.size(), values, label);
    }

    /**
     * Returns at most {@code limit} details, in stored order.
     */
    public List<String> topDetails(int limit) {
        return details.size() <= limit ? details : details.subList(0, limit);
    }
}
