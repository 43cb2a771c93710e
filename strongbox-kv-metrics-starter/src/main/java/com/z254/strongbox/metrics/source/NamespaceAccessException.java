package com.z254.strongbox.metrics.source;

/**
 * The namespace tree could not be read. Aborts the whole collection tick.
 */
public class NamespaceAccessException extends SecretSourceException {

    public NamespaceAccessException(String message) {
        super(message);
    }

    public NamespaceAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
