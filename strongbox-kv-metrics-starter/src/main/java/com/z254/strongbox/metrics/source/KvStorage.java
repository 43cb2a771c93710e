package com.z254.strongbox.metrics.source;

import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.KvMount;

import java.util.List;

/**
 * Logical "list children" primitive scoped to a mount.
 */
@FunctionalInterface
public interface KvStorage {

    /**
     * List the immediate children of {@code key} under {@code mount}.
     * <p>
     * {@code key} is relative to the mount and is either empty (the mount root) or
     * ends with {@code /}. Returned names are relative to {@code key}; a name ending
     * with {@code /} is a sub-directory, any other name is a leaf. An absent directory
     * lists as empty.
     *
     * @throws StorageListException if the list operation fails
     */
    List<String> listChildren(CollectionContext context, KvMount mount, String key);
}
