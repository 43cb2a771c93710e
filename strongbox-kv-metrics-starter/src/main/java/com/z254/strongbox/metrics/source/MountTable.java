package com.z254.strongbox.metrics.source;

import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.MountEntry;
import com.z254.strongbox.metrics.domain.Namespace;

import java.util.List;

/**
 * Read access to the mount table of a namespace.
 */
public interface MountTable {

    /**
     * All mount entries of the given namespace, of every engine type.
     *
     * @throws MountTableException if the namespace's mount table cannot be read
     */
    List<MountEntry> listMounts(CollectionContext context, Namespace namespace);
}
