package com.gene.evidence.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Process-wide reference to the current {@link ServedSnapshot}.
 *
 * <p>Requests read {@link #current()} once and work against that value. A reload builds a
 * complete new snapshot first and only then swaps the reference, so a request never sees a
 * half-loaded state.</p>
 */
public class ServedSnapshotHolder {
    private static final Logger log = LoggerFactory.getLogger(ServedSnapshotHolder.class);

    private final AtomicReference<ServedSnapshot> current;

    public ServedSnapshotHolder(ServedSnapshot initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial snapshot is required"));
    }

    public ServedSnapshot current() {
        return current.get();
    }

    /**
     * Replaces the served snapshot and returns the previous one.
     */
    public ServedSnapshot swap(ServedSnapshot next) {
        ServedSnapshot previous = current.getAndSet(Objects.requireNonNull(next, "snapshot is required"));
        log.info("snapshot.swapped previousLoadedAt={} loadedAt={}", previous.getLoadedAt(), next.getLoadedAt());
        return previous;
    }

    /**
     * Builds a new snapshot with the given loader and swaps it in. If building fails the
     * current snapshot stays served and the exception propagates.
     */
    public ServedSnapshot reload(Supplier<ServedSnapshot> loader) {
        ServedSnapshot next = loader.get();
        swap(next);
        return next;
    }
}
