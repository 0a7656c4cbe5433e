package com.atlas.store;

/**
 * Thrown when a record snapshot cannot be read as a whole. Individual bad
 * records never raise this; they are skipped and counted.
 */
public class SnapshotLoadException extends RuntimeException {

    public SnapshotLoadException(String message) {
        super(message);
    }

    public SnapshotLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
