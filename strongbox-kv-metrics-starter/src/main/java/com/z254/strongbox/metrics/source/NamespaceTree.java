package com.z254.strongbox.metrics.source;

import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.Namespace;

import java.util.List;

/**
 * Read access to the platform's namespace hierarchy.
 */
public interface NamespaceTree {

    /**
     * The root of the tree. Always present.
     */
    default Namespace root() {
        return Namespace.root();
    }

    /**
     * Immediate children of {@code parent}.
     *
     * @throws NamespaceAccessException if the tree cannot be read
     */
    List<Namespace> children(CollectionContext context, Namespace parent);
}
