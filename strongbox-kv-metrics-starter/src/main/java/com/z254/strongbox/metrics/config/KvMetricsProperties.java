package com.z254.strongbox.metrics.config;

import com.z254.strongbox.metrics.domain.KvVersion;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the KV secret count gauge.
 * <p>
 * Configuration example:
 * <pre>
 * strongbox:
 *   metrics:
 *     kv:
 *       source: vault
 *       collection-interval: 10m
 *       collection-timeout: 5m
 *       max-concurrent-walks: 4
 * </pre>
 */
@ConfigurationProperties(prefix = "strongbox.metrics.kv")
public class KvMetricsProperties {

    /**
     * Enable the KV secret gauge.
     */
    private boolean enabled = true;

    /**
     * Source of namespaces, mounts and keys: inmemory or vault.
     */
    private String source = "inmemory";

    /**
     * Run collection periodically. When disabled the collector is only run on demand.
     */
    private boolean schedulingEnabled = true;

    /**
     * Delay between the end of one collection and the start of the next.
     */
    private Duration collectionInterval = Duration.ofMinutes(10);

    /**
     * Delay before the first collection after startup.
     */
    private Duration initialDelay = Duration.ofSeconds(30);

    /**
     * Deadline of one collection tick. Mounts not walked by then are reported as cancelled.
     */
    private Duration collectionTimeout = Duration.ofMinutes(5);

    /**
     * Maximum number of mounts walked concurrently.
     */
    private int maxConcurrentWalks = 4;

    /**
     * Maximum number of gauge rows exported per tick; negative for unlimited.
     * Collection reports always hold every sample.
     */
    private int maxGaugeCardinality = 500;

    /**
     * Layout assumed for mounts whose version option is not recognized.
     */
    private KvVersion unrecognizedVersionLayout = KvVersion.UNVERSIONED;

    /**
     * Mount types counted as key-value engines.
     */
    private List<String> engineTypes = List.of("kv", "generic");

    public Set<String> engineTypeSet() {
        return new LinkedHashSet<>(engineTypes);
    }

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public boolean isSchedulingEnabled() {
        return schedulingEnabled;
    }

    public void setSchedulingEnabled(boolean schedulingEnabled) {
        this.schedulingEnabled = schedulingEnabled;
    }

    public Duration getCollectionInterval() {
        return collectionInterval;
    }

    public void setCollectionInterval(Duration collectionInterval) {
        this.collectionInterval = collectionInterval;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getCollectionTimeout() {
        return collectionTimeout;
    }

    public void setCollectionTimeout(Duration collectionTimeout) {
        this.collectionTimeout = collectionTimeout;
    }

    public int getMaxConcurrentWalks() {
        return maxConcurrentWalks;
    }

    public void setMaxConcurrentWalks(int maxConcurrentWalks) {
        this.maxConcurrentWalks = maxConcurrentWalks;
    }

    public int getMaxGaugeCardinality() {
        return maxGaugeCardinality;
    }

    public void setMaxGaugeCardinality(int maxGaugeCardinality) {
        this.maxGaugeCardinality = maxGaugeCardinality;
    }

    public KvVersion getUnrecognizedVersionLayout() {
        return unrecognizedVersionLayout;
    }

    public void setUnrecognizedVersionLayout(KvVersion unrecognizedVersionLayout) {
        this.unrecognizedVersionLayout = unrecognizedVersionLayout;
    }

    public List<String> getEngineTypes() {
        return engineTypes;
    }

    public void setEngineTypes(List<String> engineTypes) {
        this.engineTypes = engineTypes;
    }
}
