package com.gene.evidence.snapshot;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Fail-soft result of reading an artifact: the parsed value when {@link ArtifactStatus#LOADED},
 * otherwise the caller-supplied empty value plus the reason.
 */
public record LoadedArtifact<T>(Path path, ArtifactStatus status, T value, String error) {

    public LoadedArtifact {
        Objects.requireNonNull(status, "status is required");
    }

    public static <T> LoadedArtifact<T> loaded(Path path, T value) {
        return new LoadedArtifact<>(path, ArtifactStatus.LOADED, value, null);
    }

    public static <T> LoadedArtifact<T> missing(Path path, T emptyValue) {
        return new LoadedArtifact<>(path, ArtifactStatus.MISSING, emptyValue, "Not found: " + path);
    }

    public static <T> LoadedArtifact<T> malformed(Path path, T emptyValue, String error) {
        return new LoadedArtifact<>(path, ArtifactStatus.MALFORMED, emptyValue, error);
    }
}
