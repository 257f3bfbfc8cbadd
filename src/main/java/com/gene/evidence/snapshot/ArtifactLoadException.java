package com.gene.evidence.snapshot;

import java.nio.file.Path;

/**
 * Runtime exception thrown when an artifact exists but cannot be read or parsed.
 */
public class ArtifactLoadException extends RuntimeException {

    private final transient Path path;

    public ArtifactLoadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
