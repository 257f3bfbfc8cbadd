package com.gene.evidence.snapshot;

/**
 * Outcome of loading one tier artifact.
 */
public enum ArtifactStatus {
    LOADED,
    MISSING,
    MALFORMED;

    public boolean isUsable() {
        return this == LOADED;
    }
}
