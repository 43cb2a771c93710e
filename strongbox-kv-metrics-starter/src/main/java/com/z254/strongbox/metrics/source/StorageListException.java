package com.z254.strongbox.metrics.source;

import com.z254.strongbox.metrics.domain.KvMount;

/**
 * A list operation under a mount failed. Ends the walk of that mount only.
 */
public class StorageListException extends SecretSourceException {

    private final transient KvMount mount;
    private final String key;
    private final boolean mountMissing;

    public StorageListException(KvMount mount, String key, String message, Throwable cause) {
        this(mount, key, false, message, cause);
    }

    public StorageListException(KvMount mount, String key, boolean mountMissing, String message, Throwable cause) {
        super(message, cause);
        this.mount = mount;
        this.key = key;
        this.mountMissing = mountMissing;
    }

    public static StorageListException mountMissing(KvMount mount, String key) {
        return new StorageListException(mount, key, true,
                "No route to mount " + mount.getMountPoint() + " while listing '" + key + "'", null);
    }

    public KvMount getMount() {
        return mount;
    }

    public String getKey() {
        return key;
    }

    /**
     * True when the path no longer routes to a mount, typically because the mount was
     * removed after enumeration.
     */
    public boolean isMountMissing() {
        return mountMissing;
    }
}
