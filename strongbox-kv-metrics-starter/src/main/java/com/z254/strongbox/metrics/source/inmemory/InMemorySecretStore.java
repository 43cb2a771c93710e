package com.z254.strongbox.metrics.source.inmemory;

import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.KvMount;
import com.z254.strongbox.metrics.domain.KvVersion;
import com.z254.strongbox.metrics.domain.MountEntry;
import com.z254.strongbox.metrics.domain.Namespace;
import com.z254.strongbox.metrics.source.KvStorage;
import com.z254.strongbox.metrics.source.MountTable;
import com.z254.strongbox.metrics.source.MountTableException;
import com.z254.strongbox.metrics.source.NamespaceAccessException;
import com.z254.strongbox.metrics.source.NamespaceTree;
import com.z254.strongbox.metrics.source.StorageListException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory namespace tree, mount table and logical storage for development and testing.
 * <p>
 * This store:
 * <ul>
 *   <li>Keeps namespaces, mounts and storage keys in memory (non-persistent)</li>
 *   <li>Lays out secrets the way each KV version does, so versioned mounts carry both
 *       {@code metadata/} and {@code versions/} keys</li>
 *   <li>Lists children the way the platform's logical storage does, with directories
 *       suffixed by {@code /}</li>
 * </ul>
 * <p>
 * <b>Warning:</b> This store is NOT suitable for production use.
 * Use the Vault-backed source for production deployments.
 */
public class InMemorySecretStore implements NamespaceTree, MountTable, KvStorage {

    private static final Logger log = LoggerFactory.getLogger(InMemorySecretStore.class);

    static final String VERSIONS_PREFIX = "versions/";

    private final ConcurrentMap<String, Namespace> namespaces = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<Namespace>> childrenByParent = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, NavigableMap<String, MountEntry>> mountsByNamespace = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, NavigableSet<String>> keysByMount = new ConcurrentHashMap<>();
    private final AtomicLong namespaceSequence = new AtomicLong();

    public InMemorySecretStore() {
        Namespace root = Namespace.root();
        namespaces.put(root.getId(), root);
        mountsByNamespace.put(root.getId(), new ConcurrentSkipListMap<>());
        log.info("Initialized in-memory secret store (development mode)");
    }

    // =========================================================================
    // Namespaces
    // =========================================================================

    /**
     * Create a child namespace named {@code name} below {@code parent}.
     */
    public Namespace createNamespace(Namespace parent, String name) {
        requireNamespace(parent);
        String path = parent.getPath() + sanitizePath(name);
        Namespace child = new Namespace("ns" + namespaceSequence.incrementAndGet(), path);
        addNamespace(parent, child);
        return child;
    }

    /**
     * Attach an existing namespace below {@code parent}.
     */
    public void addNamespace(Namespace parent, Namespace child) {
        requireNamespace(parent);
        if (namespaces.putIfAbsent(child.getId(), child) != null) {
            throw new IllegalStateException("Namespace already exists: " + child.getId());
        }
        childrenByParent.computeIfAbsent(parent.getId(), id -> new CopyOnWriteArrayList<>()).add(child);
        mountsByNamespace.put(child.getId(), new ConcurrentSkipListMap<>());
        log.debug("Created namespace {} under {}", child.getPath(), parent.metricLabel());
    }

    @Override
    public List<Namespace> children(CollectionContext context, Namespace parent) {
        context.ensureActive();
        if (!namespaces.containsKey(parent.getId())) {
            throw new NamespaceAccessException("Unknown namespace: " + parent.getId());
        }
        return List.copyOf(childrenByParent.getOrDefault(parent.getId(), List.of()));
    }

    // =========================================================================
    // Mount table
    // =========================================================================

    public void mount(Namespace namespace, MountEntry entry) {
        NavigableMap<String, MountEntry> mounts = mountTable(namespace);
        MountEntry sanitized = MountEntry.builder()
                .path(sanitizePath(entry.getPath()))
                .type(entry.getType())
                .options(entry.getOptions())
                .build();
        if (mounts.putIfAbsent(sanitized.getPath(), sanitized) != null) {
            throw new IllegalStateException("Path already in use: " + namespace.getPath() + sanitized.getPath());
        }
        keysByMount.put(storageKey(namespace, sanitized.getPath()), new ConcurrentSkipListSet<>());
        log.debug("Mounted {} engine at {}{}", sanitized.getType(), namespace.getPath(), sanitized.getPath());
    }

    /**
     * Mount a key-value engine with the given {@code version} option.
     */
    public void mountKv(Namespace namespace, String path, String version) {
        MountEntry.MountEntryBuilder builder = MountEntry.builder().path(path).type("kv");
        if (version != null) {
            builder.option(MountEntry.VERSION_OPTION, version);
        }
        mount(namespace, builder.build());
    }

    public void unmount(Namespace namespace, String path) {
        String mountPath = sanitizePath(path);
        mountTable(namespace).remove(mountPath);
        keysByMount.remove(storageKey(namespace, mountPath));
    }

    @Override
    public List<MountEntry> listMounts(CollectionContext context, Namespace namespace) {
        context.ensureActive();
        NavigableMap<String, MountEntry> mounts = mountsByNamespace.get(namespace.getId());
        if (mounts == null) {
            throw new MountTableException(namespace, "No mount table for namespace " + namespace.getId());
        }
        return new ArrayList<>(mounts.values());
    }

    // =========================================================================
    // Storage
    // =========================================================================

    /**
     * Store a secret at a logical path, laid out according to the mount's version.
     */
    public void writeSecret(Namespace namespace, String mountPath, String secretPath) {
        MountEntry entry = requireMount(namespace, mountPath);
        NavigableSet<String> keys = keys(namespace, entry.getPath());
        KvVersion version = KvVersion.fromOption(entry.versionOption(), KvVersion.UNVERSIONED);
        if (version == KvVersion.VERSIONED) {
            keys.add(KvVersion.VERSIONED.getRootPrefix() + secretPath);
            keys.add(VERSIONS_PREFIX + versionDigest(secretPath) + "/1");
        } else {
            keys.add(secretPath);
        }
    }

    public void deleteSecret(Namespace namespace, String mountPath, String secretPath) {
        MountEntry entry = requireMount(namespace, mountPath);
        NavigableSet<String> keys = keys(namespace, entry.getPath());
        KvVersion version = KvVersion.fromOption(entry.versionOption(), KvVersion.UNVERSIONED);
        if (version == KvVersion.VERSIONED) {
            keys.remove(KvVersion.VERSIONED.getRootPrefix() + secretPath);
            String versionDir = VERSIONS_PREFIX + versionDigest(secretPath) + "/";
            keys.removeIf(key -> key.startsWith(versionDir));
        } else {
            keys.remove(secretPath);
        }
    }

    /**
     * Store a raw storage key under a mount, bypassing the version layout.
     */
    public void putRaw(Namespace namespace, String mountPath, String key) {
        MountEntry entry = requireMount(namespace, mountPath);
        keys(namespace, entry.getPath()).add(key);
    }

    @Override
    public List<String> listChildren(CollectionContext context, KvMount mount, String key) {
        context.ensureActive();
        NavigableSet<String> keys = keysByMount.get(storageKey(mount.getNamespace(), mount.getMountPoint()));
        if (keys == null) {
            throw StorageListException.mountMissing(mount, key);
        }

        Set<String> children = new LinkedHashSet<>();
        for (String stored : keys.tailSet(key, true)) {
            if (!stored.startsWith(key)) {
                break;
            }
            String remainder = stored.substring(key.length());
            if (remainder.isEmpty()) {
                continue;
            }
            int slash = remainder.indexOf('/');
            children.add(slash >= 0 ? remainder.substring(0, slash + 1) : remainder);
        }
        return new ArrayList<>(children);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void requireNamespace(Namespace namespace) {
        if (!namespaces.containsKey(namespace.getId())) {
            throw new IllegalArgumentException("Unknown namespace: " + namespace.getId());
        }
    }

    private NavigableMap<String, MountEntry> mountTable(Namespace namespace) {
        NavigableMap<String, MountEntry> mounts = mountsByNamespace.get(namespace.getId());
        if (mounts == null) {
            throw new IllegalArgumentException("Unknown namespace: " + namespace.getId());
        }
        return mounts;
    }

    private MountEntry requireMount(Namespace namespace, String mountPath) {
        MountEntry entry = mountTable(namespace).get(sanitizePath(mountPath));
        if (entry == null) {
            throw new IllegalArgumentException("No mount at " + namespace.getPath() + mountPath);
        }
        return entry;
    }

    private NavigableSet<String> keys(Namespace namespace, String mountPath) {
        return keysByMount.computeIfAbsent(storageKey(namespace, mountPath), k -> new ConcurrentSkipListSet<>());
    }

    private static String storageKey(Namespace namespace, String mountPath) {
        return namespace.getId() + ":" + mountPath;
    }

    static String sanitizePath(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    private static String versionDigest(String secretPath) {
        return UUID.nameUUIDFromBytes(secretPath.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
