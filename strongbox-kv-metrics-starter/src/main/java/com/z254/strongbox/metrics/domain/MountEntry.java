package com.z254.strongbox.metrics.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Read-only view of one mount-table entry.
 */
@Value
@Builder
public class MountEntry {

    public static final String VERSION_OPTION = "version";

    /** Mount path, unique within its namespace (e.g. "secret/") */
    @NonNull
    String path;

    /** Secret engine type (e.g. "kv", "generic", "transit") */
    @NonNull
    String type;

    /** Engine configuration options */
    @Singular
    Map<String, String> options;

    public String option(String name) {
        return options.get(name);
    }

    public String versionOption() {
        return option(VERSION_OPTION);
    }
}
