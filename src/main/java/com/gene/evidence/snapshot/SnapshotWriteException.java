package com.gene.evidence.snapshot;

/**
 * Runtime exception thrown when an artifact cannot be written.
 * The previously published artifact, if any, is left in place.
 */
public class SnapshotWriteException extends RuntimeException {

    public SnapshotWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
