package com.zero.core.cache;

/**
 * Thrown when an artifact cannot be read from or written to the backing store.
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message) {
        super(message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
