package com.gene.evidence.health;

import com.gene.evidence.core.model.Tier;
import com.gene.evidence.snapshot.ServedSnapshot;
import com.gene.evidence.snapshot.ServedSnapshotHolder;

import java.util.ArrayList;
import java.util.List;

/**
 * Availability of the served tiers.
 *
 * <p>DOWN when the curated tier has no data, since nothing else is served without it.
 * DEGRADED when any other tier is unavailable. Details carry each tier's artifact status
 * and size.</p>
 */
public class SnapshotHealthCheck implements HealthCheck {

    private final ServedSnapshotHolder holder;

    public SnapshotHealthCheck(ServedSnapshotHolder holder) {
        this.holder = holder;
    }

    @Override
    public String getName() {
        return "snapshot";
    }

    @Override
    public HealthStatus check() {
        ServedSnapshot snapshot = holder.current();
        List<String> unavailable = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            if (!snapshot.isAvailable(tier)) {
                unavailable.add(tier.getParamName());
            }
        }

        HealthStatus base;
        if (!snapshot.isAvailable(Tier.CURATED)) {
            base = HealthStatus.down("Curated tier not loaded");
        } else if (!unavailable.isEmpty()) {
            base = HealthStatus.degraded("Tiers unavailable: " + String.join(", ", unavailable));
        } else {
            base = HealthStatus.up("All tiers loaded");
        }

        for (Tier tier : Tier.values()) {
            base = base.withDetail(tier.getParamName(),
                    snapshot.getStatus(tier).name() + " (" + snapshot.size(tier) + ")");
        }
        return base.withDetail("loadedAt", snapshot.getLoadedAt().toString());
    }
}
