package com.z254.strongbox.metrics.collector;

import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.Namespace;
import com.z254.strongbox.metrics.source.NamespaceAccessException;
import com.z254.strongbox.metrics.source.NamespaceTree;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flattens the namespace tree into the list of namespaces to scan.
 */
@Slf4j
public class NamespaceEnumerator {

    private final NamespaceTree namespaceTree;

    public NamespaceEnumerator(NamespaceTree namespaceTree) {
        this.namespaceTree = namespaceTree;
    }

    /**
     * Breadth-first listing of the root and all of its descendants, root first, each
     * namespace exactly once.
     *
     * @throws NamespaceAccessException if any level of the tree cannot be read
     */
    public List<Namespace> listNamespaces(CollectionContext context) {
        Namespace root = namespaceTree.root();
        List<Namespace> namespaces = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<Namespace> pending = new ArrayDeque<>();
        pending.add(root);
        seen.add(root.getId());

        while (!pending.isEmpty()) {
            Namespace current = pending.poll();
            namespaces.add(current);
            for (Namespace child : namespaceTree.children(context, current)) {
                if (seen.add(child.getId())) {
                    pending.add(child);
                } else {
                    log.debug("Skipping namespace {} already listed", child.getPath());
                }
            }
        }

        log.debug("Enumerated {} namespaces", namespaces.size());
        return namespaces;
    }
}
