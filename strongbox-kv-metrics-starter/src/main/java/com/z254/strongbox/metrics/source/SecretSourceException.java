package com.z254.strongbox.metrics.source;

/**
 * Base type for failures reported by the platform collaborators the collector reads
 * from. Subtypes tell the collector how far a failure reaches.
 */
public class SecretSourceException extends RuntimeException {

    public SecretSourceException(String message) {
        super(message);
    }

    public SecretSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
