package com.gene.evidence.tier;

import com.gene.evidence.core.model.Tier;

/**
 * Thrown when a requested tier, and every tier it may fall back to, has no data.
 * Carries a remediation hint naming the batch step that produces the missing artifact.
 */
public class TierUnavailableException extends RuntimeException {

    private final Tier tier;
    private final String hint;

    public TierUnavailableException(Tier tier, String message, String hint) {
        super(message);
        this.tier = tier;
        this.hint = hint;
    }

    public Tier getTier() {
        return tier;
    }

    public String getHint() {
        return hint;
    }
}
