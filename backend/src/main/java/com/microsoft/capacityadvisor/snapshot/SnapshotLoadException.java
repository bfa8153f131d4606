package com.microsoft.capacityadvisor.snapshot;

/**
 * A resource snapshot document could not be read or parsed.
 */
public class SnapshotLoadException extends RuntimeException {

    public SnapshotLoadException(String message) {
        super(message);
    }

    public SnapshotLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
