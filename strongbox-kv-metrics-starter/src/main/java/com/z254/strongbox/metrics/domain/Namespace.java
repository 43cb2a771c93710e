package com.z254.strongbox.metrics.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Tenant namespace used as a scoping key for mounts.
 * <p>
 * Namespaces form a tree rooted at {@link #root()}. The root has the id {@code root}
 * and an empty path; child paths carry a trailing slash (e.g. {@code "team-a/"}).
 */
@Value
public class Namespace {

    public static final String ROOT_ID = "root";
    public static final String ROOT_LABEL = "root";

    private static final Namespace ROOT = new Namespace(ROOT_ID, "");

    /** Stable namespace identifier */
    @NonNull
    String id;

    /** Full path from the root, empty for the root namespace */
    @NonNull
    String path;

    public static Namespace root() {
        return ROOT;
    }

    public boolean isRoot() {
        return ROOT_ID.equals(id);
    }

    /**
     * Value of the {@code namespace} label on emitted samples.
     */
    public String metricLabel() {
        return isRoot() ? ROOT_LABEL : path;
    }
}
