package org.ergs.fixie.core.storage;

/**
 * Wraps checked I/O exceptions from artifact operations.
 */
public class ArtifactException extends RuntimeException {

    public ArtifactException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArtifactException(String message) {
        super(message);
    }
}
