package com.z254.strongbox.metrics.collector;

import com.z254.strongbox.metrics.domain.CollectionCancelledException;
import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.KvMount;
import com.z254.strongbox.metrics.domain.MountWalkResult;
import com.z254.strongbox.metrics.source.KvStorage;
import com.z254.strongbox.metrics.source.StorageListException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Counts the leaf secrets of one mount.
 * <p>
 * Traversal uses an explicit work list seeded with the layout root, so the depth of
 * the key space does not bound the call stack. Versioned mounts are only walked under
 * {@code metadata/}; payload prefixes next to it are never listed.
 */
@Slf4j
public class SecretTreeWalker {

    private static final String SEPARATOR = "/";

    private final KvStorage storage;

    public SecretTreeWalker(KvStorage storage) {
        this.storage = storage;
    }

    /**
     * Walk the mount and count its leaves. Never throws for storage failures: the first
     * failed list ends the walk with a failed result, and no partial count is reported.
     */
    public MountWalkResult walk(CollectionContext context, KvMount mount) {
        Deque<String> pending = new ArrayDeque<>();
        pending.push(mount.rootPrefix());
        long count = 0;

        while (!pending.isEmpty()) {
            if (context.isDone() || Thread.currentThread().isInterrupted()) {
                log.debug("Walk of {} cancelled after {} secrets", mount, count);
                return MountWalkResult.cancelled(mount);
            }

            String directory = pending.pop();
            List<String> children;
            try {
                children = storage.listChildren(context, mount, directory);
            } catch (CollectionCancelledException e) {
                log.debug("Walk of {} cancelled: {}", mount, e.getMessage());
                return MountWalkResult.cancelled(mount);
            } catch (StorageListException e) {
                if (e.isMountMissing()) {
                    log.debug("Mount {} disappeared during walk", mount);
                } else {
                    log.error("Failed to list '{}' under mount_point={} namespace={}",
                            directory, mount.getMountPoint(), mount.getNamespace().metricLabel(), e);
                }
                return MountWalkResult.failure(mount, e);
            }

            for (String child : children) {
                if (child.endsWith(SEPARATOR)) {
                    pending.push(directory + child);
                } else {
                    count++;
                }
            }
        }

        return MountWalkResult.success(mount, count);
    }
}
