package com.z254.strongbox.metrics.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One labeled point-in-time value of the KV secret count gauge.
 * <p>
 * Carries exactly two labels, {@value #MOUNT_POINT_LABEL} and {@value #NAMESPACE_LABEL}.
 */
@Value
public class GaugeSample {

    public static final String MOUNT_POINT_LABEL = "mount_point";
    public static final String NAMESPACE_LABEL = "namespace";

    @NonNull
    String mountPoint;

    @NonNull
    String namespace;

    long value;

    public static GaugeSample of(KvMount mount, long value) {
        return new GaugeSample(mount.getMountPoint(), mount.getNamespace().metricLabel(), value);
    }

    /**
     * Labels in emission order.
     */
    public Map<String, String> labels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(MOUNT_POINT_LABEL, mountPoint);
        labels.put(NAMESPACE_LABEL, namespace);
        return labels;
    }
}
