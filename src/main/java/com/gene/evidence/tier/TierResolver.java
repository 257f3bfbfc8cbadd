package com.gene.evidence.tier;

import com.gene.evidence.core.model.Tier;
import com.gene.evidence.snapshot.ServedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which tier answers a request.
 *
 * <p>Each tier has an ordered fallback chain whose first available entry is served. When
 * the whole chain is empty the terminal state is "unavailable", reported as a
 * {@link TierUnavailableException}. Resolution only inspects the given snapshot; it never
 * reads files or triggers recomputation.</p>
 *
 * <pre>
 * curated  -> [curated]
 * expanded -> [expanded, curated]
 * genome   -> [genome]
 * derived  -> [derived]
 * </pre>
 */
public class TierResolver {
    private static final Logger log = LoggerFactory.getLogger(TierResolver.class);

    private static final Map<Tier, List<Tier>> FALLBACK_CHAINS;
    private static final Map<Tier, Unavailable> UNAVAILABLE;

    private record Unavailable(String message, String hint) {
    }

    static {
        EnumMap<Tier, List<Tier>> chains = new EnumMap<>(Tier.class);
        chains.put(Tier.CURATED, List.of(Tier.CURATED));
        chains.put(Tier.EXPANDED, List.of(Tier.EXPANDED, Tier.CURATED));
        chains.put(Tier.GENOME, List.of(Tier.GENOME));
        chains.put(Tier.DERIVED, List.of(Tier.DERIVED));
        FALLBACK_CHAINS = Collections.unmodifiableMap(chains);

        EnumMap<Tier, Unavailable> unavailable = new EnumMap<>(Tier.class);
        unavailable.put(Tier.CURATED, new Unavailable("Curated data not loaded",
                "Run the curated pipeline (just generate) to produce output/sources.json"));
        unavailable.put(Tier.EXPANDED, new Unavailable("No gene data available",
                "Run the gene expansion step and the curated pipeline"));
        unavailable.put(Tier.GENOME, new Unavailable("Genome-wide data not available",
                "Run the genome-wide cross-reference job to produce derived/genome_wide_summary.json"));
        unavailable.put(Tier.DERIVED, new Unavailable("Gap candidates not available",
                "Run the gap derivation job to produce derived/gap_candidates.json"));
        UNAVAILABLE = Collections.unmodifiableMap(unavailable);
    }

    public static List<Tier> fallbackChain(Tier requested) {
        return FALLBACK_CHAINS.get(requested);
    }

    public TierResolution resolve(Tier requested, ServedSnapshot snapshot) {
        for (Tier candidate : FALLBACK_CHAINS.get(requested)) {
            if (!snapshot.isAvailable(candidate)) {
                continue;
            }
            if (candidate == requested) {
                return TierResolution.direct(requested);
            }
            String reason = capitalize(requested.getParamName()) + " data not available, serving "
                    + candidate.getParamName();
            log.debug("tier.fallback requested={} served={}", requested, candidate);
            return new TierResolution(requested, candidate, reason);
        }
        Unavailable terminal = UNAVAILABLE.get(requested);
        throw new TierUnavailableException(requested, terminal.message(), terminal.hint());
    }

    /**
     * Remediation hint for a tier whose artifact is missing.
     */
    public static String hintFor(Tier tier) {
        return UNAVAILABLE.get(tier).hint();
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
