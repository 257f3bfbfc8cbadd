package com.gene.evidence.source;

import com.gene.evidence.core.model.GeneRecord;

/**
 * Heuristic rule removing genes from the expanded universe.
 * Rules are derived, not canonical, and are listed in artifact provenance.
 */
public interface ExclusionRule {

    boolean excludes(GeneRecord gene);

    /**
     * Human-readable rule name recorded as a non-canonical provenance element.
     */
    String describe();
}
