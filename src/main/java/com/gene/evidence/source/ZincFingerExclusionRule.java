package com.gene.evidence.source;

import com.gene.evidence.core.model.GeneRecord;

/**
 * Drops genes selected only through the C2H2 zinc finger gene group, which is too broad
 * to signal relevance on its own.
 */
public class ZincFingerExclusionRule implements ExclusionRule {

    static final String MARKER = "Zinc fingers C2H2";

    @Override
    public boolean excludes(GeneRecord gene) {
        return gene.source().contains(MARKER);
    }

    @Override
    public String describe() {
        return "ZNF exclusion rule";
    }
}
