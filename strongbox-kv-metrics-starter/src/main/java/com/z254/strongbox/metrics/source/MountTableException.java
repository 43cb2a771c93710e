package com.z254.strongbox.metrics.source;

import com.z254.strongbox.metrics.domain.Namespace;

/**
 * The mount table of one namespace could not be read. Only that namespace is skipped.
 */
public class MountTableException extends SecretSourceException {

    private final transient Namespace namespace;

    public MountTableException(Namespace namespace, String message) {
        super(message);
        this.namespace = namespace;
    }

    public MountTableException(Namespace namespace, String message, Throwable cause) {
        super(message, cause);
        this.namespace = namespace;
    }

    public Namespace getNamespace() {
        return namespace;
    }
}
