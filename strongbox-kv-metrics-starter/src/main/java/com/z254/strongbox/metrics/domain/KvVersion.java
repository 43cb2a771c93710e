package com.z254.strongbox.metrics.domain;

/**
 * Storage layout of a key-value mount.
 * <p>
 * Resolved once per mount from the loosely typed {@code version} option so the walker
 * never has to interpret raw option strings.
 */
public enum KvVersion {

    /** Version "1": leaf keys live directly under the mount root. */
    UNVERSIONED("1", ""),

    /** Version "2": live secrets are virtualized under {@code metadata/}. */
    VERSIONED("2", "metadata/");

    private final String optionValue;
    private final String rootPrefix;

    KvVersion(String optionValue, String rootPrefix) {
        this.optionValue = optionValue;
        this.rootPrefix = rootPrefix;
    }

    public String getOptionValue() {
        return optionValue;
    }

    /**
     * Key prefix, relative to the mount, where counting starts.
     */
    public String getRootPrefix() {
        return rootPrefix;
    }

    /**
     * Whether the raw option value maps to a known layout. Missing and empty values
     * count as known (they mean version "1").
     */
    public static boolean isRecognized(String optionValue) {
        return optionValue == null
                || optionValue.isEmpty()
                || UNVERSIONED.optionValue.equals(optionValue)
                || VERSIONED.optionValue.equals(optionValue);
    }

    /**
     * Resolve a raw {@code version} option.
     *
     * @param optionValue raw value, may be null
     * @param fallback    layout used for values that are not recognized
     */
    public static KvVersion fromOption(String optionValue, KvVersion fallback) {
        if (optionValue == null || optionValue.isEmpty() || UNVERSIONED.optionValue.equals(optionValue)) {
            return UNVERSIONED;
        }
        if (VERSIONED.optionValue.equals(optionValue)) {
            return VERSIONED;
        }
        return fallback;
    }
}
