package com.z254.strongbox.metrics.collector;

import com.z254.strongbox.metrics.domain.CollectionCancelledException;
import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.KvMount;
import com.z254.strongbox.metrics.domain.KvVersion;
import com.z254.strongbox.metrics.domain.MountEntry;
import com.z254.strongbox.metrics.domain.Namespace;
import com.z254.strongbox.metrics.source.MountTable;
import com.z254.strongbox.metrics.source.MountTableException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds the key-value mounts of each namespace and resolves their storage layout.
 */
@Slf4j
public class MountEnumerator {

    public static final Set<String> DEFAULT_ENGINE_TYPES = Set.of("kv", "generic");

    private final MountTable mountTable;
    private final Set<String> engineTypes;
    private final KvVersion unrecognizedVersionLayout;

    public MountEnumerator(MountTable mountTable) {
        this(mountTable, DEFAULT_ENGINE_TYPES, KvVersion.UNVERSIONED);
    }

    public MountEnumerator(MountTable mountTable, Set<String> engineTypes, KvVersion unrecognizedVersionLayout) {
        this.mountTable = mountTable;
        this.engineTypes = engineTypes.stream()
                .map(type -> type.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.unrecognizedVersionLayout = unrecognizedVersionLayout;
    }

    /**
     * KV mounts of a single namespace, zero-secret mounts included.
     *
     * @throws MountTableException if the namespace's mount table cannot be read
     */
    public List<KvMount> findKvMounts(CollectionContext context, Namespace namespace) {
        List<KvMount> mounts = new ArrayList<>();
        for (MountEntry entry : mountTable.listMounts(context, namespace)) {
            if (!engineTypes.contains(entry.getType().toLowerCase(Locale.ROOT))) {
                continue;
            }
            mounts.add(new KvMount(namespace, entry.getPath(), resolveVersion(namespace, entry)));
        }
        return mounts;
    }

    /**
     * KV mounts across namespaces. A namespace whose mount table cannot be read is
     * logged and contributes nothing; the others are still enumerated.
     * <p>
     * On cancellation the context is marked cancelled and the mounts found so far are
     * returned.
     */
    public List<KvMount> findKvMounts(CollectionContext context, List<Namespace> namespaces) {
        List<KvMount> mounts = new ArrayList<>();
        for (Namespace namespace : namespaces) {
            try {
                mounts.addAll(findKvMounts(context, namespace));
            } catch (MountTableException e) {
                log.warn("Skipping namespace {}: mount table unreadable: {}",
                        namespace.metricLabel(), e.getMessage());
            } catch (CollectionCancelledException e) {
                log.info("Mount enumeration cancelled at namespace {} after {} mounts: {}",
                        namespace.metricLabel(), mounts.size(), e.getMessage());
                context.cancel();
                break;
            }
        }
        return mounts;
    }

    private KvVersion resolveVersion(Namespace namespace, MountEntry entry) {
        String raw = entry.versionOption();
        if (!KvVersion.isRecognized(raw)) {
            log.warn("Mount {} in namespace {} has unrecognized version '{}', walking it as version {}",
                    entry.getPath(), namespace.metricLabel(), raw, unrecognizedVersionLayout.getOptionValue());
        }
        return KvVersion.fromOption(raw, unrecognizedVersionLayout);
    }
}
