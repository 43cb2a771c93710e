package com.z254.strongbox.metrics.observability;

import com.z254.strongbox.metrics.domain.CollectionReport;
import com.z254.strongbox.metrics.domain.GaugeSample;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Micrometer binding for KV secret collection.
 * <p>
 * Provides:
 * <ul>
 *     <li>{@value #SECRET_COUNT_GAUGE}: secrets per mount, tagged by mount point and namespace</li>
 *     <li>{@value #COLLECTION_ERROR_COUNTER}: one increment per failed mount walk</li>
 *     <li>{@value #COLLECTION_TIMER}: duration of each collection tick</li>
 * </ul>
 * The number of gauge rows can be capped. The report handed to {@link #publish} is
 * never altered; only the exported rows are limited.
 */
@Slf4j
public class KvSecretMetrics {

    public static final String SECRET_COUNT_GAUGE = "secrets.kv.count";
    public static final String COLLECTION_ERROR_COUNTER = "metrics.collection.error";
    public static final String COLLECTION_TIMER = "metrics.collection";
    public static final String GAUGE_TAG = "gauge";
    public static final String GAUGE_NAME = "kv_secrets_by_mountpoint";

    /** Largest value first, then namespace, then mount point */
    static final Comparator<GaugeSample> LARGEST_FIRST = Comparator
            .comparingLong(GaugeSample::getValue).reversed()
            .thenComparing(GaugeSample::getNamespace)
            .thenComparing(GaugeSample::getMountPoint);

    private final MultiGauge secretCount;
    @Getter
    private final Counter collectionErrors;
    private final Timer collectionTimer;
    private final int maxGaugeCardinality;

    private final AtomicReference<CollectionOutcome> lastOutcome = new AtomicReference<>();

    public KvSecretMetrics(MeterRegistry meterRegistry) {
        this(meterRegistry, -1);
    }

    /**
     * @param maxGaugeCardinality maximum number of gauge rows to export; a negative
     *                            value means unlimited
     */
    public KvSecretMetrics(MeterRegistry meterRegistry, int maxGaugeCardinality) {
        this.maxGaugeCardinality = maxGaugeCardinality;
        this.secretCount = MultiGauge.builder(SECRET_COUNT_GAUGE)
                .description("Number of secrets stored per KV mount")
                .baseUnit("secrets")
                .register(meterRegistry);
        this.collectionErrors = Counter.builder(COLLECTION_ERROR_COUNTER)
                .description("Mount walks that failed during gauge collection")
                .tag(GAUGE_TAG, GAUGE_NAME)
                .register(meterRegistry);
        this.collectionTimer = Timer.builder(COLLECTION_TIMER)
                .description("Time spent collecting the KV secret gauge")
                .tag(GAUGE_TAG, GAUGE_NAME)
                .register(meterRegistry);
    }

    public void recordCollectionError() {
        collectionErrors.increment();
    }

    /**
     * Replace the published gauge rows with the report's samples. Rows of mounts that
     * are absent from the report are removed. Over the cardinality cap only the largest
     * samples are exported.
     */
    public void publish(CollectionReport report) {
        List<GaugeSample> exported = selectRows(report.getSamples(), maxGaugeCardinality);
        int truncated = report.getSamples().size() - exported.size();
        if (truncated > 0) {
            log.warn("KV secret gauge exceeded max cardinality {}: dropped {} smallest rows",
                    maxGaugeCardinality, truncated);
        }
        List<MultiGauge.Row<?>> rows = exported.stream()
                .map(KvSecretMetrics::toRow)
                .collect(Collectors.toList());
        secretCount.register(rows, true);
        collectionTimer.record(report.duration());
        lastOutcome.set(CollectionOutcome.completed(report, truncated));
    }

    /**
     * Remember that a tick aborted. Published rows are left in place.
     */
    public void recordCollectionFailure(Throwable cause, Duration elapsed) {
        collectionTimer.record(elapsed);
        lastOutcome.set(CollectionOutcome.aborted(cause));
    }

    public Optional<CollectionOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }

    /**
     * The samples to export under the cap: the largest values, kept in input order.
     */
    static List<GaugeSample> selectRows(List<GaugeSample> samples, int maxCardinality) {
        if (maxCardinality < 0 || samples.size() <= maxCardinality) {
            return samples;
        }
        Set<GaugeSample> largest = samples.stream()
                .sorted(LARGEST_FIRST)
                .limit(maxCardinality)
                .collect(Collectors.toSet());
        return samples.stream()
                .filter(largest::contains)
                .collect(Collectors.toList());
    }

    private static MultiGauge.Row<?> toRow(GaugeSample sample) {
        return MultiGauge.Row.of(
                Tags.of(GaugeSample.MOUNT_POINT_LABEL, sample.getMountPoint(),
                        GaugeSample.NAMESPACE_LABEL, sample.getNamespace()),
                sample.getValue());
    }

    /**
     * What the most recent tick produced. {@code truncatedRows} counts the samples left
     * out of the export by the cardinality cap.
     */
    public record CollectionOutcome(CollectionReport report, int truncatedRows, String failure, Instant at) {

        static CollectionOutcome completed(CollectionReport report, int truncatedRows) {
            Instant at = report.getCompletedAt() != null ? report.getCompletedAt() : Instant.now();
            return new CollectionOutcome(report, truncatedRows, null, at);
        }

        static CollectionOutcome aborted(Throwable cause) {
            return new CollectionOutcome(null, 0, String.valueOf(cause.getMessage()), Instant.now());
        }

        public boolean isCompleted() {
            return report != null;
        }
    }
}
