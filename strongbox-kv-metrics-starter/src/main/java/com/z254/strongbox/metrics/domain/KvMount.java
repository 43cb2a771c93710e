package com.z254.strongbox.metrics.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * A key-value mount resolved for one collection tick.
 */
@Value
public class KvMount {

    @NonNull
    Namespace namespace;

    /** Mount path as it appears in the mount table */
    @NonNull
    String mountPoint;

    @NonNull
    KvVersion version;

    public String rootPrefix() {
        return version.getRootPrefix();
    }

    @Override
    public String toString() {
        return namespace.metricLabel() + ":" + mountPoint + " (v" + version.getOptionValue() + ")";
    }
}
