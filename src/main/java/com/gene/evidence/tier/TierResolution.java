package com.gene.evidence.tier;

import com.gene.evidence.core.model.Tier;

import java.util.Objects;

/**
 * Outcome of resolving a requested tier: which tier is actually served and, for a
 * fallback, why.
 */
public record TierResolution(Tier requested, Tier served, String reason) {

    public TierResolution {
        Objects.requireNonNull(requested, "requested is required");
        Objects.requireNonNull(served, "served is required");
    }

    public static TierResolution direct(Tier tier) {
        return new TierResolution(tier, tier, null);
    }

    public boolean isFallback() {
        return requested != served;
    }
}
