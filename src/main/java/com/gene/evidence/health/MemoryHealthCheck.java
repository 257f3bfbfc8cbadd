package com.gene.evidence.health;

import com.gene.evidence.core.model.Tier;
import com.gene.evidence.snapshot.ServedSnapshot;
import com.gene.evidence.snapshot.ServedSnapshotHolder;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.Locale;

/**
 * Heap headroom for the in-memory served snapshot.
 *
 * <p>A reload builds the new snapshot next to the current one, so both are briefly on the
 * heap together. The check reports how many entries are being served and turns DEGRADED
 * once the heap could no longer hold a second copy of a snapshot that size.</p>
 */
public class MemoryHealthCheck implements HealthCheck {

    private static final double DOWN_THRESHOLD = 0.95;
    private static final double DEGRADED_THRESHOLD = 0.80;

    private final ServedSnapshotHolder holder;

    public MemoryHealthCheck(ServedSnapshotHolder holder) {
        this.holder = holder;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public HealthStatus check() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        return evaluate(heap.getUsed() / (1024 * 1024), heap.getMax() / (1024 * 1024), servedEntries(holder.current()));
    }

    static int servedEntries(ServedSnapshot snapshot) {
        int total = 0;
        for (Tier tier : Tier.values()) {
            total += snapshot.size(tier);
        }
        return total;
    }

    static HealthStatus evaluate(long usedMb, long maxMb, int servedEntries) {
        double usage = maxMb > 0 ? (double) usedMb / maxMb : 0.0;
        String percent = String.format(Locale.ROOT, "%.1f%%", usage * 100);

        HealthStatus base;
        if (usage >= DOWN_THRESHOLD) {
            base = HealthStatus.down("Heap usage critical: " + percent + " with " + servedEntries
                    + " served entries; reloads will fail");
        } else if (usage >= DEGRADED_THRESHOLD) {
            base = HealthStatus.degraded("Heap usage high: " + percent + " with " + servedEntries
                    + " served entries; a reload may not fit");
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("heapUsedMB", usedMb)
                .withDetail("heapMaxMB", maxMb)
                .withDetail("servedEntries", servedEntries);
    }
}
